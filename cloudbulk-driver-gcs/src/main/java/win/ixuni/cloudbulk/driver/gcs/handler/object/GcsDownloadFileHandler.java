package win.ixuni.cloudbulk.driver.gcs.handler.object;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * GCS download handler
 */
public class GcsDownloadFileHandler extends AbstractGcsHandler<DownloadFileOperation, StorageObject> {

    @Override
    protected Mono<StorageObject> doHandle(DownloadFileOperation operation, GcsDriverContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return blocking(() -> {
            Blob blob = context.getStorage().get(BlobId.of(bucketName, key));
            if (blob == null) {
                if (context.getStorage().get(bucketName) == null) {
                    throw new BucketNotFoundException(bucketName);
                }
                throw new ObjectNotFoundException(bucketName, key);
            }
            blob.downloadTo(operation.getDestination());
            return toStorageObject(blob);
        });
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
