package win.ixuni.cloudbulk.core.transfer;

/**
 * How a bulk transfer reacts to failed items
 */
public enum FailurePolicy {

    /**
     * Run every item, then fail with {@link win.ixuni.cloudbulk.core.exception.BulkTransferException}
     * if any item failed
     */
    FAIL_AT_END,

    /**
     * Cancel outstanding items on the first failure and fail the call
     */
    FAIL_FAST,

    /**
     * Never fail the call; failures are only reported in the result
     */
    COLLECT
}
