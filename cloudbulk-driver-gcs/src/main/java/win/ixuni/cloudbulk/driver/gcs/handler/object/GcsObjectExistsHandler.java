package win.ixuni.cloudbulk.driver.gcs.handler.object;

import com.google.cloud.storage.BlobId;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * GCS object existence handler
 */
public class GcsObjectExistsHandler extends AbstractGcsHandler<ObjectExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(ObjectExistsOperation operation, GcsDriverContext context) {
        String bucketName = operation.getBucketName();

        return blocking(() -> {
            if (context.getStorage().get(BlobId.of(bucketName, operation.getKey())) != null) {
                return true;
            }
            if (context.getStorage().get(bucketName) == null) {
                throw new BucketNotFoundException(bucketName);
            }
            return false;
        });
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
