package win.ixuni.cloudbulk.driver.memory.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Memory list handler
 * <p>
 * The continuation token is the last key of the previous page.
 */
@Slf4j
public class MemoryListObjectsHandler extends AbstractMemoryHandler<ListObjectsOperation, ListObjectsPage> {

    @Override
    protected Mono<ListObjectsPage> doHandle(ListObjectsOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        NavigableMap<String, MemoryDriverContext.ObjectData> objects = context.requireBucket(bucketName).getObjects();

        String prefix = operation.getPrefix() != null ? operation.getPrefix() : "";
        String token = operation.getContinuationToken();
        NavigableMap<String, MemoryDriverContext.ObjectData> candidates = token != null
                ? objects.tailMap(token, false)
                : objects.tailMap(prefix, true);

        List<StorageObject> page = new ArrayList<>();
        String lastKey = null;
        boolean more = false;
        for (MemoryDriverContext.ObjectData data : candidates.values()) {
            if (!data.getKey().startsWith(prefix)) {
                // sorted keys: past the prefix range
                break;
            }
            if (page.size() == operation.getMaxKeys()) {
                more = true;
                break;
            }
            page.add(toStorageObject(bucketName, data));
            lastKey = data.getKey();
        }

        log.debug("ListObjects: bucket={}, prefix={}, found {} objects", bucketName, prefix, page.size());

        return Mono.just(ListObjectsPage.builder()
                .objects(page)
                .nextContinuationToken(more ? lastKey : null)
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
