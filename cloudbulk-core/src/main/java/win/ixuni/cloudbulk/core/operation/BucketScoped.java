package win.ixuni.cloudbulk.core.operation;

/**
 * Operation that targets a bucket, and optionally one key inside it
 * <p>
 * Exception translators use it to name the missing resource.
 */
public interface BucketScoped {

    String getBucketName();

    /**
     * @return target key, null for bucket-level operations
     */
    default String getKey() {
        return null;
    }
}
