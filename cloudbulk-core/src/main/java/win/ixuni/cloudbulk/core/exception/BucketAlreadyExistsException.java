package win.ixuni.cloudbulk.core.exception;

/**
 * Bucket already exists exception
 */
public class BucketAlreadyExistsException extends CloudBulkException {

    public BucketAlreadyExistsException(String bucketName) {
        super("BucketAlreadyExists", "The requested bucket name is not available: " + bucketName, 409);
    }

    public BucketAlreadyExistsException(String bucketName, Throwable cause) {
        super("BucketAlreadyExists", "The requested bucket name is not available: " + bucketName, 409, cause);
    }
}
