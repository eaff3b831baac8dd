package win.ixuni.cloudbulk.core.exception;

/**
 * Bucket not empty exception
 */
public class BucketNotEmptyException extends CloudBulkException {

    public BucketNotEmptyException(String bucketName) {
        super("BucketNotEmpty", "The bucket you tried to delete is not empty: " + bucketName, 409);
    }

    public BucketNotEmptyException(String bucketName, Throwable cause) {
        super("BucketNotEmpty", "The bucket you tried to delete is not empty: " + bucketName, 409, cause);
    }
}
