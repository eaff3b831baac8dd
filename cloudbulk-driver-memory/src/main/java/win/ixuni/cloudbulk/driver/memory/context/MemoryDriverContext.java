package win.ixuni.cloudbulk.driver.memory.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudbulk.driver.memory.MemoryDriverFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Memory driver context
 * <p>
 * Holds the buckets; each bucket keeps its objects sorted by key so listings come out in
 * lexicographic order.
 */
@Getter
@Builder
public class MemoryDriverContext implements DriverContext {

    private final DriverConfig config;

    /**
     * bucketName -> BucketData
     */
    @Builder.Default
    private final Map<String, BucketData> buckets = new ConcurrentHashMap<>();

    /**
     * Delay applied before every operation
     */
    @Builder.Default
    private final Duration simulatedLatency = Duration.ZERO;

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    /**
     * @throws BucketNotFoundException when the bucket does not exist
     */
    public BucketData requireBucket(String bucketName) {
        BucketData bucket = buckets.get(bucketName);
        if (bucket == null) {
            throw new BucketNotFoundException(bucketName);
        }
        return bucket;
    }

    // ============ Data Structure Definitions ============

    @Getter
    public static class BucketData {
        private final String name;
        private final Instant creationDate;
        private final NavigableMap<String, ObjectData> objects = new ConcurrentSkipListMap<>();

        public BucketData(String name, Instant creationDate) {
            this.name = name;
            this.creationDate = creationDate;
        }
    }

    @Getter
    @Builder
    public static class ObjectData {
        private final String key;
        private final byte[] data;
        private final String etag;
        private final String contentType;
        private final Instant lastModified;
    }
}
