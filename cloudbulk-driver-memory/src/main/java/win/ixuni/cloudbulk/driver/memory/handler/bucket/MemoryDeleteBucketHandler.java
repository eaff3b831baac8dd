package win.ixuni.cloudbulk.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotEmptyException;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * Memory delete bucket handler
 */
public class MemoryDeleteBucketHandler extends AbstractMemoryHandler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        MemoryDriverContext.BucketData bucket = context.requireBucket(bucketName);

        if (!bucket.getObjects().isEmpty()) {
            return Mono.error(new BucketNotEmptyException(bucketName));
        }
        context.getBuckets().remove(bucketName, bucket);
        return Mono.empty();
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.BUCKET_MANAGEMENT);
    }
}
