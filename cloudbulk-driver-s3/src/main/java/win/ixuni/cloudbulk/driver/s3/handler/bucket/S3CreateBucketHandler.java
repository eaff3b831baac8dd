package win.ixuni.cloudbulk.driver.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageBucket;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * S3 create bucket handler
 * <p>
 * An existing bucket surfaces as BucketAlreadyExists / BucketAlreadyOwnedByYou and is
 * translated by the interceptor.
 */
public class S3CreateBucketHandler implements OperationHandler<CreateBucketOperation, StorageBucket> {

    @Override
    public Mono<StorageBucket> handle(CreateBucketOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        String bucketName = operation.getBucketName();

        return Mono.fromFuture(() -> ctx.getS3Client().createBucket(
                        CreateBucketRequest.builder()
                                .bucket(bucketName)
                                .build()))
                .map(response -> StorageBucket.builder()
                        .name(bucketName)
                        .creationDate(Instant.now())
                        .build());
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
