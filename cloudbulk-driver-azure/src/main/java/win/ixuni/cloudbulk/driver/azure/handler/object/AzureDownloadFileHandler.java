package win.ixuni.cloudbulk.driver.azure.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Azure download handler
 */
public class AzureDownloadFileHandler implements OperationHandler<DownloadFileOperation, StorageObject> {

    @Override
    public Mono<StorageObject> handle(DownloadFileOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;

        return ctx.blob(operation.getBucketName(), operation.getKey())
                .downloadToFile(operation.getDestination().toString(), true)
                .map(properties -> StorageObject.builder()
                        .bucketName(operation.getBucketName())
                        .key(operation.getKey())
                        .size(properties.getBlobSize())
                        .etag(properties.getETag())
                        .lastModified(properties.getLastModified() != null
                                ? properties.getLastModified().toInstant()
                                : null)
                        .contentType(properties.getContentType())
                        .build());
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
