package win.ixuni.cloudbulk.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of a listing
 */
@Value
@Builder
public class ListObjectsPage {

    @Builder.Default
    List<StorageObject> objects = List.of();

    /**
     * Token for the next page, null when the listing is exhausted
     */
    String nextContinuationToken;

    public boolean hasMore() {
        return nextContinuationToken != null && !nextContinuationToken.isEmpty();
    }
}
