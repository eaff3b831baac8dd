package win.ixuni.cloudbulk.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.transfer.s3.model.CompletedFileUpload;
import software.amazon.awssdk.transfer.s3.model.UploadFileRequest;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * S3 upload handler
 * <p>
 * Uses the transfer manager when configured, otherwise a single PutObject streamed from the file.
 */
public class S3UploadFileHandler implements OperationHandler<UploadFileOperation, StorageObject> {

    @Override
    public Mono<StorageObject> handle(UploadFileOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .contentType(operation.getContentType())
                .build();

        Mono<PutObjectResponse> response;
        if (ctx.getTransferManager() != null) {
            response = Mono.fromFuture(() -> ctx.getTransferManager().uploadFile(
                            UploadFileRequest.builder()
                                    .putObjectRequest(request)
                                    .source(operation.getSource())
                                    .build())
                            .completionFuture())
                    .map(CompletedFileUpload::response);
        } else {
            response = Mono.fromFuture(() -> ctx.getS3Client().putObject(
                    request, AsyncRequestBody.fromFile(operation.getSource())));
        }

        return response.map(put -> StorageObject.builder()
                .bucketName(operation.getBucketName())
                .key(operation.getKey())
                .etag(put.eTag())
                .lastModified(Instant.now())
                .contentType(operation.getContentType())
                .build());
    }

    @Override
    public Class<UploadFileOperation> getOperationType() {
        return UploadFileOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
