package win.ixuni.cloudbulk.driver.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.Operation;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;

/**
 * Base class for memory handlers
 * <p>
 * Provides type-safe context access and applies the simulated latency.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractMemoryHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof MemoryDriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected MemoryDriverContext but got: " + context.getClass().getName()));
        }
        MemoryDriverContext ctx = (MemoryDriverContext) context;
        Mono<R> result = Mono.defer(() -> doHandle(operation, ctx));
        if (ctx.getSimulatedLatency().isZero()) {
            return result;
        }
        return Mono.delay(ctx.getSimulatedLatency()).then(result);
    }

    /**
     * Handle the operation with a type-safe MemoryDriverContext
     *
     * @param operation the operation
     * @param context   memory driver context
     * @return operation result
     */
    protected abstract Mono<R> doHandle(O operation, MemoryDriverContext context);

    protected static StorageObject toStorageObject(String bucketName, MemoryDriverContext.ObjectData data) {
        return StorageObject.builder()
                .bucketName(bucketName)
                .key(data.getKey())
                .size((long) data.getData().length)
                .etag(data.getEtag())
                .lastModified(data.getLastModified())
                .contentType(data.getContentType())
                .build();
    }
}
