package win.ixuni.cloudbulk.driver.gcs.handler.bucket;

import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.BucketInfo;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageBucket;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * GCS create bucket handler
 */
public class GcsCreateBucketHandler extends AbstractGcsHandler<CreateBucketOperation, StorageBucket> {

    @Override
    protected Mono<StorageBucket> doHandle(CreateBucketOperation operation, GcsDriverContext context) {
        return blocking(() -> {
            Bucket bucket = context.getStorage().create(BucketInfo.of(operation.getBucketName()));
            return StorageBucket.builder()
                    .name(operation.getBucketName())
                    .creationDate(bucket != null && bucket.getCreateTimeOffsetDateTime() != null
                            ? bucket.getCreateTimeOffsetDateTime().toInstant()
                            : Instant.now())
                    .build();
        });
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
