package win.ixuni.cloudbulk.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Memory batch delete handler
 */
public class MemoryDeleteObjectsHandler extends AbstractMemoryHandler<DeleteObjectsOperation, Integer> {

    @Override
    protected Mono<Integer> doHandle(DeleteObjectsOperation operation, MemoryDriverContext context) {
        Map<String, MemoryDriverContext.ObjectData> objects =
                context.requireBucket(operation.getBucketName()).getObjects();

        int deleted = 0;
        for (String key : operation.getKeys()) {
            if (objects.remove(key) != null) {
                deleted++;
            }
        }
        return Mono.just(deleted);
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
