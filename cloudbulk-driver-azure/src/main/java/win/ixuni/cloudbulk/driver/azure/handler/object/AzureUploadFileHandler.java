package win.ixuni.cloudbulk.driver.azure.handler.object;

import com.azure.storage.blob.models.BlobHttpHeaders;
import com.azure.storage.blob.models.ParallelTransferOptions;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Azure upload handler
 * <p>
 * {@code uploadFromFile} without request conditions replaces an existing blob.
 */
public class AzureUploadFileHandler implements OperationHandler<UploadFileOperation, StorageObject> {

    @Override
    public Mono<StorageObject> handle(UploadFileOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;

        BlobHttpHeaders headers = operation.getContentType() != null
                ? new BlobHttpHeaders().setContentType(operation.getContentType())
                : null;

        return ctx.blob(operation.getBucketName(), operation.getKey())
                .uploadFromFile(operation.getSource().toString(),
                        new ParallelTransferOptions().setMaxConcurrency(ctx.getMaxConcurrency()),
                        headers, null, null, null)
                .then(Mono.fromSupplier(() -> StorageObject.builder()
                        .bucketName(operation.getBucketName())
                        .key(operation.getKey())
                        .lastModified(Instant.now())
                        .contentType(operation.getContentType())
                        .build()));
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
