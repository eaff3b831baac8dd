package win.ixuni.cloudbulk.core.exception;

import lombok.Getter;

/**
 * CloudBulk base exception
 * <p>
 * {@code statusCode} carries the HTTP status reported by the backend, or the closest
 * equivalent for failures raised locally.
 */
@Getter
public class CloudBulkException extends RuntimeException {

    private final String errorCode;
    private final int statusCode;

    public CloudBulkException(String errorCode, String message, int statusCode) {
        super(message);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }

    public CloudBulkException(String errorCode, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }
}
