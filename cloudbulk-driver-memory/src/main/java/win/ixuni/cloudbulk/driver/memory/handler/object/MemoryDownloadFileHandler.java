package win.ixuni.cloudbulk.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.nio.file.Files;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory download handler
 */
public class MemoryDownloadFileHandler extends AbstractMemoryHandler<DownloadFileOperation, StorageObject> {

    @Override
    protected Mono<StorageObject> doHandle(DownloadFileOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        MemoryDriverContext.ObjectData object = context.requireBucket(bucketName)
                .getObjects().get(operation.getKey());
        if (object == null) {
            return Mono.error(new ObjectNotFoundException(bucketName, operation.getKey()));
        }

        return Mono.fromCallable(() -> Files.write(operation.getDestination(), object.getData()))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(toStorageObject(bucketName, object));
    }

    @Override
    public Class<DownloadFileOperation> getOperationType() {
        return DownloadFileOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
