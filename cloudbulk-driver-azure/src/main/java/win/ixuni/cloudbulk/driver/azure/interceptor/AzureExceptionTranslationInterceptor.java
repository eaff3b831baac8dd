package win.ixuni.cloudbulk.driver.azure.interceptor;

import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobStorageException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.HandlerInterceptor;
import win.ixuni.cloudbulk.core.operation.InterceptorChain;
import win.ixuni.cloudbulk.core.operation.Operation;

/**
 * Azure exception translation interceptor
 * <p>
 * Converts {@link BlobStorageException} error codes to the CloudBulk exception hierarchy.
 */
@Slf4j
public class AzureExceptionTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, DriverContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(BlobStorageException.class, e -> translateException(operation, e));
    }

    Throwable translateException(Operation<?> operation, BlobStorageException e) {
        BlobErrorCode errorCode = e.getErrorCode();
        String containerName = "unknown";
        String key = null;
        if (operation instanceof BucketScoped scoped) {
            containerName = scoped.getBucketName();
            key = scoped.getKey();
        }

        if (BlobErrorCode.CONTAINER_NOT_FOUND.equals(errorCode)) {
            return new BucketNotFoundException(containerName, e);
        }
        if (BlobErrorCode.BLOB_NOT_FOUND.equals(errorCode)) {
            return new ObjectNotFoundException(containerName, key, e);
        }
        if (BlobErrorCode.CONTAINER_ALREADY_EXISTS.equals(errorCode)) {
            return new BucketAlreadyExistsException(containerName, e);
        }
        if (BlobErrorCode.CONTAINER_BEING_DELETED.equals(errorCode)) {
            return new CloudBulkException("OperationAborted",
                    "Container is being deleted, retry later: " + containerName, 409, e);
        }
        if (errorCode == null && e.getStatusCode() == 404) {
            return key != null
                    ? new ObjectNotFoundException(containerName, key, e)
                    : new BucketNotFoundException(containerName, e);
        }
        log.debug("Unmapped Azure error code: {} (HTTP {}), passing through", errorCode, e.getStatusCode());
        return e;
    }

    @Override
    public int getOrder() {
        return 100;
    }
}
