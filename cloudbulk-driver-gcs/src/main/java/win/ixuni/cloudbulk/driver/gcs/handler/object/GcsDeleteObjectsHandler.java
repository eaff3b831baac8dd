package win.ixuni.cloudbulk.driver.gcs.handler.object;

import com.google.cloud.storage.BlobId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * GCS batch delete handler
 * <p>
 * Missing blobs come back as {@code false} and are not counted.
 */
public class GcsDeleteObjectsHandler extends AbstractGcsHandler<DeleteObjectsOperation, Integer> {

    /**
     * Calls per JSON batch request accepted by the service
     */
    static final int BATCH_SIZE = 100;

    @Override
    protected Mono<Integer> doHandle(DeleteObjectsOperation operation, GcsDriverContext context) {
        String bucketName = operation.getBucketName();

        return Flux.fromIterable(operation.getKeys())
                .map(key -> BlobId.of(bucketName, key))
                .buffer(BATCH_SIZE)
                .concatMap(batch -> blocking(() -> countDeleted(context.getStorage().delete(batch))))
                .reduce(0, Integer::sum);
    }

    private static int countDeleted(List<Boolean> results) {
        int deleted = 0;
        for (Boolean result : results) {
            if (Boolean.TRUE.equals(result)) {
                deleted++;
            }
        }
        return deleted;
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
