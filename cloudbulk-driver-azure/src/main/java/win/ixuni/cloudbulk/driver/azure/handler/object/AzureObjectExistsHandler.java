package win.ixuni.cloudbulk.driver.azure.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Azure blob existence handler
 * <p>
 * {@code exists()} is false for a missing container too; the container is checked in that case.
 */
public class AzureObjectExistsHandler implements OperationHandler<ObjectExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(ObjectExistsOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;
        String containerName = operation.getBucketName();

        return ctx.blob(containerName, operation.getKey()).exists()
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.just(true);
                    }
                    return context.execute(new BucketExistsOperation(containerName))
                            .flatMap(containerExists -> containerExists
                                    ? Mono.just(false)
                                    : Mono.error(new BucketNotFoundException(containerName)));
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
