package win.ixuni.cloudbulk.core.exception;

import lombok.Getter;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.core.model.TransferItemResult;

/**
 * Raised when one or more items of a bulk transfer failed
 * <p>
 * The partial {@link BulkTransferResult} is attached; the first failure is the cause and
 * every other failure is added as suppressed.
 */
@Getter
public class BulkTransferException extends CloudBulkException {

    private final transient BulkTransferResult result;

    public BulkTransferException(BulkTransferResult result) {
        super("BulkTransferFailed", buildMessage(result), 500, firstCause(result));
        this.result = result;
        result.failures().stream()
                .skip(1)
                .map(TransferItemResult::getError)
                .filter(e -> e != null && e != getCause())
                .limit(16)
                .forEach(this::addSuppressed);
    }

    private static String buildMessage(BulkTransferResult result) {
        return String.format("%s of %d items failed during %s to bucket '%s'",
                result.getFailedCount(), result.getItems().size(),
                result.getDirection().name().toLowerCase(), result.getBucket());
    }

    private static Throwable firstCause(BulkTransferResult result) {
        return result.failures().stream()
                .map(TransferItemResult::getError)
                .findFirst()
                .orElse(null);
    }
}
