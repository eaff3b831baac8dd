package win.ixuni.cloudbulk.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends CloudBulkException {

    public ObjectNotFoundException(String bucketName, String key) {
        super("NoSuchKey", "The specified key does not exist: " + bucketName + "/" + key, 404);
    }

    public ObjectNotFoundException(String bucketName, String key, Throwable cause) {
        super("NoSuchKey", "The specified key does not exist: " + bucketName + "/" + key, 404, cause);
    }
}
