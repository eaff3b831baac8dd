package win.ixuni.cloudbulk.core.transfer;

import lombok.Builder;
import lombok.Value;

/**
 * Bulk transfer settings
 */
@Value
@Builder(toBuilder = true)
public class TransferOptions {

    public static final int DEFAULT_CONCURRENCY = 50;

    /**
     * Maximum number of items in flight
     */
    @Builder.Default
    int concurrency = DEFAULT_CONCURRENCY;

    @Builder.Default
    FailurePolicy failurePolicy = FailurePolicy.FAIL_AT_END;

    /**
     * Log every completed item at INFO instead of DEBUG
     */
    boolean verbose;

    /**
     * Replace existing local files on download
     */
    @Builder.Default
    boolean overwrite = true;

    public static TransferOptions defaults() {
        return TransferOptions.builder().build();
    }

    public TransferOptions withConcurrency(int concurrency) {
        return toBuilder().concurrency(concurrency).build();
    }
}
