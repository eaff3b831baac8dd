package win.ixuni.cloudbulk.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * Memory bucket existence handler
 */
public class MemoryBucketExistsHandler extends AbstractMemoryHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, MemoryDriverContext context) {
        return Mono.just(context.getBuckets().containsKey(operation.getBucketName()));
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.BUCKET_MANAGEMENT);
    }
}
