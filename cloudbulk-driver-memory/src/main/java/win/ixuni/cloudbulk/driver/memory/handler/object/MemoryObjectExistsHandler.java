package win.ixuni.cloudbulk.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * Memory object existence handler
 */
public class MemoryObjectExistsHandler extends AbstractMemoryHandler<ObjectExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(ObjectExistsOperation operation, MemoryDriverContext context) {
        return Mono.just(context.requireBucket(operation.getBucketName())
                .getObjects().containsKey(operation.getKey()));
    }

    @Override
    public Class<ObjectExistsOperation> getOperationType() {
        return ObjectExistsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
