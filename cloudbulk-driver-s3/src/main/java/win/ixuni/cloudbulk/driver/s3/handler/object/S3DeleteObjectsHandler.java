package win.ixuni.cloudbulk.driver.s3.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.S3Error;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * S3 batch delete handler
 * <p>
 * Sends one DeleteObjects request per {@value DeleteObjectsOperation#MAX_BATCH_SIZE} keys.
 */
@Slf4j
public class S3DeleteObjectsHandler implements OperationHandler<DeleteObjectsOperation, Integer> {

    @Override
    public Mono<Integer> handle(DeleteObjectsOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        String bucketName = operation.getBucketName();

        return Flux.fromIterable(operation.getKeys())
                .buffer(DeleteObjectsOperation.MAX_BATCH_SIZE)
                .concatMap(batch -> deleteBatch(ctx, bucketName, batch))
                .reduce(0, Integer::sum);
    }

    private Mono<Integer> deleteBatch(S3DriverContext ctx, String bucketName, List<String> keys) {
        var objectsToDelete = keys.stream()
                .map(key -> ObjectIdentifier.builder().key(key).build())
                .toList();

        var s3Request = DeleteObjectsRequest.builder()
                .bucket(bucketName)
                .delete(Delete.builder().objects(objectsToDelete).build())
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().deleteObjects(s3Request))
                .flatMap(response -> {
                    if (response.hasErrors() && !response.errors().isEmpty()) {
                        S3Error first = response.errors().get(0);
                        log.warn("DeleteObjects on {}: {} of {} keys failed, first: {} ({})",
                                bucketName, response.errors().size(), keys.size(), first.key(), first.code());
                        return Mono.error(new CloudBulkException(first.code(),
                                "Failed to delete " + response.errors().size() + " objects from " + bucketName
                                        + ", first: " + first.key() + ": " + first.message(),
                                500));
                    }
                    return Mono.just(response.deleted().size());
                });
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
