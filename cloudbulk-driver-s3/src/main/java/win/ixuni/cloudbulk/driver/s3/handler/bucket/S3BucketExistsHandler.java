package win.ixuni.cloudbulk.driver.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * S3 bucket existence handler
 */
public class S3BucketExistsHandler implements OperationHandler<BucketExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(BucketExistsOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;

        return Mono.fromFuture(() -> ctx.getS3Client().headBucket(
                        HeadBucketRequest.builder()
                                .bucket(operation.getBucketName())
                                .build()))
                .map(response -> true)
                .onErrorResume(NoSuchBucketException.class, e -> Mono.just(false))
                .onErrorResume(S3Exception.class, e -> {
                    // HEAD carries no error body: 404 is the only signal
                    if (e.statusCode() == 404) {
                        return Mono.just(false);
                    }
                    return Mono.error(e);
                });
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
