package win.ixuni.cloudbulk.driver.azure.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Azure container existence handler
 */
public class AzureBucketExistsHandler implements OperationHandler<BucketExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(BucketExistsOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;
        return ctx.container(operation.getBucketName()).exists();
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
