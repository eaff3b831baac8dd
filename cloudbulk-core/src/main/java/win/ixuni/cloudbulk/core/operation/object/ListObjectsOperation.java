package win.ixuni.cloudbulk.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

/**
 * List one page of objects under a prefix, in lexicographic key order
 */
@Value
@Builder
public class ListObjectsOperation implements Operation<ListObjectsPage>, BucketScoped {

    public static final int DEFAULT_MAX_KEYS = 1000;

    String bucketName;

    /**
     * Key prefix, empty for the whole bucket
     */
    @Builder.Default
    String prefix = "";

    /**
     * Token from the previous page, null for the first page
     */
    String continuationToken;

    @Builder.Default
    int maxKeys = DEFAULT_MAX_KEYS;
}
