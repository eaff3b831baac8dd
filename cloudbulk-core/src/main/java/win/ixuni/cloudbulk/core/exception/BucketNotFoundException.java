package win.ixuni.cloudbulk.core.exception;

/**
 * Bucket not found exception
 */
public class BucketNotFoundException extends CloudBulkException {

    public BucketNotFoundException(String bucketName) {
        super("NoSuchBucket", "The specified bucket does not exist: " + bucketName, 404);
    }

    public BucketNotFoundException(String bucketName, Throwable cause) {
        super("NoSuchBucket", "The specified bucket does not exist: " + bucketName, 404, cause);
    }
}
