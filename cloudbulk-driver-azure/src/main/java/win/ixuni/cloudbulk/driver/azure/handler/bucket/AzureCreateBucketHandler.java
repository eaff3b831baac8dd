package win.ixuni.cloudbulk.driver.azure.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageBucket;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Azure create container handler
 */
public class AzureCreateBucketHandler implements OperationHandler<CreateBucketOperation, StorageBucket> {

    @Override
    public Mono<StorageBucket> handle(CreateBucketOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;
        String containerName = operation.getBucketName();

        return ctx.container(containerName).create()
                .then(Mono.fromSupplier(() -> StorageBucket.builder()
                        .name(containerName)
                        .creationDate(Instant.now())
                        .build()));
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.BUCKET_MANAGEMENT);
    }
}
