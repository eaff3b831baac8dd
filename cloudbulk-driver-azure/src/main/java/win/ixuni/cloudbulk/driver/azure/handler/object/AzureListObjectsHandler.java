package win.ixuni.cloudbulk.driver.azure.handler.object;

import com.azure.core.http.rest.PagedResponse;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobItemProperties;
import com.azure.storage.blob.models.ListBlobsOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Azure list handler
 * <p>
 * Flat listing, one service page per operation.
 */
public class AzureListObjectsHandler implements OperationHandler<ListObjectsOperation, ListObjectsPage> {

    @Override
    public Mono<ListObjectsPage> handle(ListObjectsOperation operation, DriverContext context) {
        AzureBlobDriverContext ctx = (AzureBlobDriverContext) context;
        String containerName = operation.getBucketName();
        String prefix = operation.getPrefix();

        ListBlobsOptions options = new ListBlobsOptions()
                .setPrefix(prefix == null || prefix.isEmpty() ? null : prefix)
                .setMaxResultsPerPage(operation.getMaxKeys());

        var blobs = ctx.container(containerName).listBlobs(options);
        Flux<PagedResponse<BlobItem>> pages = operation.getContinuationToken() != null
                ? blobs.byPage(operation.getContinuationToken())
                : blobs.byPage();

        return pages.next()
                .map(page -> ListObjectsPage.builder()
                        .objects(page.getValue().stream()
                                .map(item -> toStorageObject(containerName, item))
                                .toList())
                        .nextContinuationToken(page.getContinuationToken())
                        .build())
                .defaultIfEmpty(ListObjectsPage.builder().build());
    }

    private StorageObject toStorageObject(String containerName, BlobItem item) {
        BlobItemProperties properties = item.getProperties();
        StorageObject.StorageObjectBuilder builder = StorageObject.builder()
                .bucketName(containerName)
                .key(item.getName());
        if (properties != null) {
            builder.size(properties.getContentLength())
                    .etag(properties.getETag())
                    .lastModified(properties.getLastModified() != null
                            ? properties.getLastModified().toInstant()
                            : null)
                    .contentType(properties.getContentType());
        }
        return builder.build();
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
