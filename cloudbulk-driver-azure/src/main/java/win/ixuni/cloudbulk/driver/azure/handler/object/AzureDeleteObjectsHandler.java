package win.ixuni.cloudbulk.driver.azure.handler.object;

import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobStorageException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Azure batch delete handler
 * <p>
 * Deletes blob by blob, {@code max-concurrency} deletes in flight.
 */
public class AzureDeleteObjectsHandler implements OperationHandler<DeleteObjectsOperation, Integer> {

    @Override
    public Mono<Integer> handle(DeleteObjectsOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;
        String containerName = operation.getBucketName();

        return Flux.fromIterable(operation.getKeys())
                .flatMap(key -> ctx.blob(containerName, key).delete()
                                .thenReturn(1)
                                .onErrorResume(BlobStorageException.class, e ->
                                        BlobErrorCode.BLOB_NOT_FOUND.equals(e.getErrorCode())
                                                ? Mono.just(0)
                                                : Mono.error(e)),
                        ctx.getMaxConcurrency())
                .reduce(0, Integer::sum);
    }

    @Override
    public Class<DeleteObjectsOperation> getOperationType() {
        return DeleteObjectsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.BATCH_DELETE);
    }
}
