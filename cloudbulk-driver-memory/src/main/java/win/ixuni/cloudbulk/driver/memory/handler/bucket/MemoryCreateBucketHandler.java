package win.ixuni.cloudbulk.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.model.StorageBucket;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory create bucket handler
 */
public class MemoryCreateBucketHandler extends AbstractMemoryHandler<CreateBucketOperation, StorageBucket> {

    @Override
    protected Mono<StorageBucket> doHandle(CreateBucketOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        MemoryDriverContext.BucketData created = new MemoryDriverContext.BucketData(bucketName, Instant.now());

        if (context.getBuckets().putIfAbsent(bucketName, created) != null) {
            return Mono.error(new BucketAlreadyExistsException(bucketName));
        }
        return Mono.just(StorageBucket.builder()
                .name(bucketName)
                .creationDate(created.getCreationDate())
                .build());
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.BUCKET_MANAGEMENT);
    }
}
