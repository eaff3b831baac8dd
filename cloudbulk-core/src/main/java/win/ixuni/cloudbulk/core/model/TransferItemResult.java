package win.ixuni.cloudbulk.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a single transfer item
 */
@Value
@Builder
public class TransferItemResult {

    StorageTransferPath path;

    boolean success;

    /**
     * Bytes moved; 0 for failed items
     */
    long bytes;

    Duration elapsed;

    /**
     * Failure cause, null when successful
     */
    Throwable error;

    public static TransferItemResult success(StorageTransferPath path, long bytes, Duration elapsed) {
        return TransferItemResult.builder()
                .path(path)
                .success(true)
                .bytes(bytes)
                .elapsed(elapsed)
                .build();
    }

    public static TransferItemResult failure(StorageTransferPath path, Throwable error, Duration elapsed) {
        return TransferItemResult.builder()
                .path(path)
                .success(false)
                .elapsed(elapsed)
                .error(error)
                .build();
    }
}
