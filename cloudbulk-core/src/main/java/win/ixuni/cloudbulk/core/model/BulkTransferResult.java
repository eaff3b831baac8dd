package win.ixuni.cloudbulk.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import win.ixuni.cloudbulk.core.exception.BulkTransferException;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate outcome of a bulk upload or download
 * <p>
 * {@link #items} keeps the order in which the paths were submitted.
 */
@Value
@Builder
public class BulkTransferResult {

    TransferDirection direction;

    String bucket;

    @Singular
    List<TransferItemResult> items;

    Duration duration;

    public static BulkTransferResult empty(TransferDirection direction, String bucket) {
        return BulkTransferResult.builder()
                .direction(direction)
                .bucket(bucket)
                .duration(Duration.ZERO)
                .build();
    }

    public int getSucceededCount() {
        return (int) items.stream().filter(TransferItemResult::isSuccess).count();
    }

    public int getFailedCount() {
        return items.size() - getSucceededCount();
    }

    public long getTotalBytes() {
        return items.stream().mapToLong(TransferItemResult::getBytes).sum();
    }

    public boolean isSuccessful() {
        return getFailedCount() == 0;
    }

    public List<TransferItemResult> failures() {
        return items.stream().filter(item -> !item.isSuccess()).toList();
    }

    /**
     * Throughput in MB/s (1 MB = 1024 * 1024 bytes), 0 when no time elapsed
     */
    public double getThroughputMbPerSecond() {
        long millis = duration.toMillis();
        if (millis <= 0) {
            return 0.0;
        }
        return (getTotalBytes() / (1024.0 * 1024.0)) / (millis / 1000.0);
    }

    /**
     * @return this result, for chaining
     * @throws BulkTransferException when any item failed
     */
    public BulkTransferResult throwIfFailed() {
        if (!isSuccessful()) {
            throw new BulkTransferException(this);
        }
        return this;
    }
}
