package win.ixuni.cloudbulk.driver.gcs.handler.object;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.Storage.BlobListOption;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.AbstractGcsHandler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * GCS list handler
 */
public class GcsListObjectsHandler extends AbstractGcsHandler<ListObjectsOperation, ListObjectsPage> {

    @Override
    protected Mono<ListObjectsPage> doHandle(ListObjectsOperation operation, GcsDriverContext context) {
        List<BlobListOption> options = new ArrayList<>();
        options.add(BlobListOption.pageSize(operation.getMaxKeys()));
        if (operation.getPrefix() != null && !operation.getPrefix().isEmpty()) {
            options.add(BlobListOption.prefix(operation.getPrefix()));
        }
        if (operation.getContinuationToken() != null) {
            options.add(BlobListOption.pageToken(operation.getContinuationToken()));
        }

        return blocking(() -> {
            Page<Blob> page = context.getStorage().list(operation.getBucketName(),
                    options.toArray(new BlobListOption[0]));
            List<StorageObject> objects = new ArrayList<>();
            for (Blob blob : page.getValues()) {
                objects.add(toStorageObject(blob));
            }
            return ListObjectsPage.builder()
                    .objects(objects)
                    .nextContinuationToken(page.getNextPageToken())
                    .build();
        });
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
