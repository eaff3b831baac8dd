package win.ixuni.cloudbulk.driver.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * S3 delete bucket handler
 */
public class S3DeleteBucketHandler implements OperationHandler<DeleteBucketOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteBucketOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;

        return Mono.fromFuture(() -> ctx.getS3Client().deleteBucket(
                        DeleteBucketRequest.builder()
                                .bucket(operation.getBucketName())
                                .build()))
                .then();
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
