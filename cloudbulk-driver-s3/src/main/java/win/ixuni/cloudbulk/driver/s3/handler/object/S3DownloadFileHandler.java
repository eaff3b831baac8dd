package win.ixuni.cloudbulk.driver.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.FileTransformerConfiguration;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.transfer.s3.model.CompletedFileDownload;
import software.amazon.awssdk.transfer.s3.model.DownloadFileRequest;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * S3 download handler
 */
public class S3DownloadFileHandler implements OperationHandler<DownloadFileOperation, StorageObject> {

    @Override
    public Mono<StorageObject> handle(DownloadFileOperation operation, DriverContext context) {
        S3DriverContext ctx = (S3DriverContext) context;

        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .build();

        Mono<GetObjectResponse> response;
        if (ctx.getTransferManager() != null) {
            response = Mono.fromFuture(() -> ctx.getTransferManager().downloadFile(
                            DownloadFileRequest.builder()
                                    .getObjectRequest(request)
                                    .destination(operation.getDestination())
                                    .build())
                            .completionFuture())
                    .map(CompletedFileDownload::response);
        } else {
            response = Mono.fromFuture(() -> ctx.getS3Client().getObject(request,
                    AsyncResponseTransformer.toFile(operation.getDestination(),
                            FileTransformerConfiguration.defaultCreateOrReplaceExisting())));
        }

        return response.map(get -> StorageObject.builder()
                .bucketName(operation.getBucketName())
                .key(operation.getKey())
                .size(get.contentLength())
                .etag(get.eTag())
                .lastModified(get.lastModified())
                .contentType(get.contentType())
                .build());
    }

    @Override
    public Class<DownloadFileOperation> getOperationType() {
        return DownloadFileOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
