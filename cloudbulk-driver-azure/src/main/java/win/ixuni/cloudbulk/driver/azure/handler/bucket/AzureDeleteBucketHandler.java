package win.ixuni.cloudbulk.driver.azure.handler.bucket;

import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.models.ListBlobsOptions;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotEmptyException;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Azure delete container handler
 * <p>
 * Azure deletes containers together with their blobs, so emptiness is checked first.
 */
public class AzureDeleteBucketHandler implements OperationHandler<DeleteBucketOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteBucketOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;
        String containerName = operation.getBucketName();
        BlobContainerAsyncClient container = ctx.container(containerName);

        return container.listBlobs(new ListBlobsOptions().setMaxResultsPerPage(1))
                .hasElements()
                .flatMap(hasBlobs -> hasBlobs
                        ? Mono.error(new BucketNotEmptyException(containerName))
                        : container.delete());
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
