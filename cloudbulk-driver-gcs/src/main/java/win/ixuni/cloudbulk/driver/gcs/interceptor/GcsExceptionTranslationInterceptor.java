package win.ixuni.cloudbulk.driver.gcs.interceptor;

import com.google.cloud.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BucketNotEmptyException;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.HandlerInterceptor;
import win.ixuni.cloudbulk.core.operation.InterceptorChain;
import win.ixuni.cloudbulk.core.operation.Operation;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;

/**
 * GCS exception translation interceptor
 * <p>
 * {@link StorageException} only carries an HTTP code, so 409 is resolved by operation type.
 */
@Slf4j
public class GcsExceptionTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, DriverContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(StorageException.class, e -> translateException(operation, e));
    }

    Throwable translateException(Operation<?> operation, StorageException e) {
        String bucketName = "unknown";
        String key = null;
        if (operation instanceof BucketScoped scoped) {
            bucketName = scoped.getBucketName();
            key = scoped.getKey();
        }

        if (e.getCode() == 404) {
            // an upload can only miss its bucket
            return key != null && !(operation instanceof UploadFileOperation)
                    ? new ObjectNotFoundException(bucketName, key, e)
                    : new BucketNotFoundException(bucketName, e);
        }
        if (e.getCode() == 409 && operation instanceof CreateBucketOperation) {
            return new BucketAlreadyExistsException(bucketName, e);
        }
        if (e.getCode() == 409 && operation instanceof DeleteBucketOperation) {
            return new BucketNotEmptyException(bucketName, e);
        }
        log.debug("Unmapped GCS error (HTTP {}, reason {}), passing through", e.getCode(), e.getReason());
        return e;
    }

    @Override
    public int getOrder() {
        return 100;
    }
}
