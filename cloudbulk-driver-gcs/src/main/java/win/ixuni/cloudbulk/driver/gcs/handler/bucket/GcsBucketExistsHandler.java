package win.ixuni.cloudbulk.driver.gcs.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * GCS bucket existence handler
 */
public class GcsBucketExistsHandler extends AbstractGcsHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, GcsDriverContext context) {
        return blocking(() -> context.getStorage().get(operation.getBucketName()) != null);
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
