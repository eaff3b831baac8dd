package win.ixuni.cloudbulk.core.exception;

/**
 * Object key that cannot be mapped onto a local path
 */
public class InvalidObjectKeyException extends CloudBulkException {

    public InvalidObjectKeyException(String key, String reason) {
        super("InvalidKey", "Invalid object key '" + key + "': " + reason, 400);
    }
}
