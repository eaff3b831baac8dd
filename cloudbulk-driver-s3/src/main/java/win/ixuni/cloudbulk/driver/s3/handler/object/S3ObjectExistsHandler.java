package win.ixuni.cloudbulk.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * S3 object existence handler
 * <p>
 * HeadObject answers 404 for a missing key and for a missing bucket alike; the bucket is
 * checked on 404 so a missing bucket is reported as such.
 */
public class S3ObjectExistsHandler implements OperationHandler<ObjectExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(ObjectExistsOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        String bucketName = operation.getBucketName();

        return Mono.fromFuture(() -> ctx.getS3Client().headObject(
                        HeadObjectRequest.builder()
                                .bucket(bucketName)
                                .key(operation.getKey())
                                .build()))
                .map(response -> true)
                .onErrorResume(S3Exception.class, e -> {
                    if (e.statusCode() != 404) {
                        return Mono.error(e);
                    }
                    return context.execute(new BucketExistsOperation(bucketName))
                            .flatMap(bucketExists -> bucketExists
                                    ? Mono.just(false)
                                    : Mono.error(new BucketNotFoundException(bucketName, e)));
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
