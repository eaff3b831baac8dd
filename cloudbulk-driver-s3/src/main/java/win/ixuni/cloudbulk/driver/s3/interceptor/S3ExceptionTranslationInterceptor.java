package win.ixuni.cloudbulk.driver.s3.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BucketNotEmptyException;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.HandlerInterceptor;
import win.ixuni.cloudbulk.core.operation.InterceptorChain;
import win.ixuni.cloudbulk.core.operation.Operation;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;

/**
 * S3 exception translation interceptor
 * <p>
 * Converts AWS SDK S3 exceptions to the CloudBulk exception hierarchy so the S3 driver fails
 * the same way as the other drivers. The transfer manager may wrap the service error, so the
 * cause chain is searched.
 */
@Slf4j
public class S3ExceptionTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, DriverContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(e -> !(e instanceof CloudBulkException) && findS3Exception(e) != null,
                        e -> translateException(operation, findS3Exception(e)));
    }

    /**
     * Convert an S3Exception to the corresponding CloudBulk exception
     */
    Throwable translateException(Operation<?> operation, S3Exception e) {
        String errorCode = e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null
                ? e.awsErrorDetails().errorCode()
                : "";
        String bucketName = "unknown";
        String key = null;
        if (operation instanceof BucketScoped scoped) {
            bucketName = scoped.getBucketName();
            key = scoped.getKey();
        }

        return switch (errorCode) {
            case "NoSuchBucket" -> new BucketNotFoundException(bucketName, e);
            case "NoSuchKey" -> new ObjectNotFoundException(bucketName, key, e);
            case "BucketNotEmpty" -> new BucketNotEmptyException(bucketName, e);
            case "BucketAlreadyOwnedByYou", "BucketAlreadyExists" ->
                    new BucketAlreadyExistsException(bucketName, e);
            default -> {
                if (e.statusCode() == 404) {
                    // HEAD responses carry no error code
                    yield key != null && !(operation instanceof UploadFileOperation)
                            ? new ObjectNotFoundException(bucketName, key, e)
                            : new BucketNotFoundException(bucketName, e);
                }
                log.debug("Unmapped S3 error code: {} (HTTP {}), passing through", errorCode, e.statusCode());
                yield e;
            }
        };
    }

    private static S3Exception findS3Exception(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof S3Exception s3Exception) {
                return s3Exception;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    @Override
    public int getOrder() {
        // innermost: translate before the logging interceptor sees the error
        return 100;
    }
}
