package win.ixuni.cloudbulk.driver.gcs.handler.object;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * GCS upload handler
 */
public class GcsUploadFileHandler extends AbstractGcsHandler<UploadFileOperation, StorageObject> {

    @Override
    protected Mono<StorageObject> doHandle(UploadFileOperation operation, GcsDriverContext context) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(operation.getBucketName(), operation.getKey()))
                .setContentType(operation.getContentType())
                .build();

        return blocking(() -> toStorageObject(context.getStorage().createFrom(blobInfo, operation.getSource())));
    }

    @Override
    public Class<UploadFileOperation> getOperationType() {
        return UploadFileOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
