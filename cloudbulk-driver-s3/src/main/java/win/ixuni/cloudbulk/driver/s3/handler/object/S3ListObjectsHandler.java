package win.ixuni.cloudbulk.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * S3 list handler (ListObjectsV2)
 */
public class S3ListObjectsHandler implements OperationHandler<ListObjectsOperation, ListObjectsPage> {

    @Override
    public Mono<ListObjectsPage> handle(ListObjectsOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;
        String bucketName = operation.getBucketName();
        String prefix = operation.getPrefix();

        var s3Request = ListObjectsV2Request.builder()
                .bucket(bucketName)
                .prefix(prefix == null || prefix.isEmpty() ? null : prefix)
                .continuationToken(operation.getContinuationToken())
                .maxKeys(operation.getMaxKeys())
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().listObjectsV2(s3Request))
                .map(response -> ListObjectsPage.builder()
                        .objects(response.contents().stream()
                                .map(obj -> StorageObject.builder()
                                        .bucketName(bucketName)
                                        .key(obj.key())
                                        .size(obj.size())
                                        .etag(obj.eTag())
                                        .lastModified(obj.lastModified())
                                        .build())
                                .toList())
                        .nextContinuationToken(Boolean.TRUE.equals(response.isTruncated())
                                ? response.nextContinuationToken()
                                : null)
                        .build());
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
