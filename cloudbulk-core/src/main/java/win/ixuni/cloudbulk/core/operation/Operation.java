package win.ixuni.cloudbulk.core.operation;

/**
 * Base interface of all storage operations
 * <p>
 * Every storage call (CreateBucket, UploadFile, ListObjects, ...) is an immutable
 * operation object; the type parameter R is the result type.
 *
 * @param <R> operation result type
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging)
     *
     * @return operation name, e.g. "CreateBucket", "UploadFile"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        // Remove "Operation" suffix
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
