package win.ixuni.cloudbulk.driver.gcs.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * GCS delete bucket handler
 * <p>
 * A non-empty bucket fails with 409, translated by the interceptor.
 */
public class GcsDeleteBucketHandler extends AbstractGcsHandler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, GcsDriverContext context) {
        String bucketName = operation.getBucketName();
        return blocking(() -> context.getStorage().delete(bucketName))
                .flatMap(deleted -> deleted
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new BucketNotFoundException(bucketName)));
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
