package win.ixuni.cloudbulk.core.operation.object;

import lombok.Value;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

import java.util.List;

/**
 * Delete a batch of keys; returns the number of keys deleted
 * <p>
 * Keys that do not exist are skipped without error.
 */
@Value
public class DeleteObjectsOperation implements Operation<Integer>, BucketScoped {

    public static final int MAX_BATCH_SIZE = 1000;

    String bucketName;

    List<String> keys;
}
