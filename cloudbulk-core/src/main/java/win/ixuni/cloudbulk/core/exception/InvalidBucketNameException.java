package win.ixuni.cloudbulk.core.exception;

/**
 * Invalid bucket name exception
 */
public class InvalidBucketNameException extends CloudBulkException {

    public InvalidBucketNameException(String bucketName, String reason) {
        super("InvalidBucketName", "Invalid bucket name '" + bucketName + "': " + reason, 400);
    }
}
