package win.ixuni.cloudbulk.driver.gcs.handler;

import com.google.cloud.storage.Blob;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.Operation;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;

import java.util.concurrent.Callable;

/**
 * Base class for GCS handlers
 * <p>
 * Gives subclasses a typed context and runs their blocking SDK calls on the bounded-elastic
 * scheduler.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractGcsHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof GcsDriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected GcsDriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (GcsDriverContext) context);
    }

    protected abstract Mono<R> doHandle(O operation, GcsDriverContext context);

    /**
     * Run a blocking call off the caller's thread
     */
    protected static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    protected static StorageObject toStorageObject(Blob blob) {
        return StorageObject.builder()
                .bucketName(blob.getBucket())
                .key(blob.getName())
                .size(blob.getSize())
                .etag(blob.getEtag())
                .lastModified(blob.getUpdateTimeOffsetDateTime() != null
                        ? blob.getUpdateTimeOffsetDateTime().toInstant()
                        : null)
                .contentType(blob.getContentType())
                .build();
    }
}
