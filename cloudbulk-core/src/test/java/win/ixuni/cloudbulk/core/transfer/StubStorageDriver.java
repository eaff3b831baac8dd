package win.ixuni.cloudbulk.core.transfer;

import lombok.Getter;
import lombok.Setter;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.AbstractStorageDriver;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BucketNotEmptyException;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageBucket;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.Operation;
import win.ixuni.cloudbulk.core.operation.OperationHandler;
import win.ixuni.cloudbulk.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Minimal in-process driver for transfer service tests
 * <p>
 * Keys listed in {@link #getFailingKeys()} fail on upload and download. In-flight transfers are
 * counted so tests can check the concurrency bound.
 */
public class StubStorageDriver extends AbstractStorageDriver {

    @Getter
    private final Map<String, NavigableMap<String, byte[]>> buckets = new ConcurrentHashMap<>();

    @Getter
    private final Set<String> failingKeys = ConcurrentHashMap.newKeySet();

    @Getter
    private final AtomicInteger transferCalls = new AtomicInteger();

    @Getter
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private final AtomicInteger inFlight = new AtomicInteger();

    @Setter
    private Duration latency = Duration.ZERO;

    @Setter
    private int pageSize = 1000;

    private final StubContext context = new StubContext();

    public StubStorageDriver() {
        this(true);
    }

    public StubStorageDriver(boolean batchDelete) {
        on(CreateBucketOperation.class, Capability.BUCKET_MANAGEMENT, op -> {
            if (buckets.putIfAbsent(op.getBucketName(), new ConcurrentSkipListMap<>()) != null) {
                return Mono.error(new BucketAlreadyExistsException(op.getBucketName()));
            }
            return Mono.just(StorageBucket.builder().name(op.getBucketName()).creationDate(Instant.now()).build());
        });
        on(BucketExistsOperation.class, Capability.BUCKET_MANAGEMENT,
                op -> Mono.just(buckets.containsKey(op.getBucketName())));
        on(DeleteBucketOperation.class, Capability.BUCKET_MANAGEMENT, op -> {
            NavigableMap<String, byte[]> objects = buckets.get(op.getBucketName());
            if (objects == null) {
                return Mono.error(new BucketNotFoundException(op.getBucketName()));
            }
            if (!objects.isEmpty()) {
                return Mono.error(new BucketNotEmptyException(op.getBucketName()));
            }
            buckets.remove(op.getBucketName());
            return Mono.empty();
        });

        on(UploadFileOperation.class, Capability.WRITE, op -> transfer(op.getKey(), () -> {
            byte[] data = Files.readAllBytes(op.getSource());
            bucket(op.getBucketName()).put(op.getKey(), data);
            return object(op.getBucketName(), op.getKey(), data);
        }));
        on(DownloadFileOperation.class, Capability.READ, op -> transfer(op.getKey(), () -> {
            byte[] data = bucket(op.getBucketName()).get(op.getKey());
            if (data == null) {
                throw new ObjectNotFoundException(op.getBucketName(), op.getKey());
            }
            Files.write(op.getDestination(), data);
            return object(op.getBucketName(), op.getKey(), data);
        }));
        on(ObjectExistsOperation.class, Capability.READ,
                op -> Mono.fromCallable(() -> bucket(op.getBucketName()).containsKey(op.getKey())));
        on(ListObjectsOperation.class, Capability.READ, op -> Mono.fromCallable(() -> list(op)));

        if (batchDelete) {
            on(DeleteObjectsOperation.class, Capability.BATCH_DELETE, op -> Mono.fromCallable(() -> {
                NavigableMap<String, byte[]> objects = bucket(op.getBucketName());
                return (int) op.getKeys().stream().filter(key -> objects.remove(key) != null).count();
            }));
        }
        context.setHandlerRegistry(getHandlerRegistry());
    }

    public void createBucket(String bucket) {
        buckets.putIfAbsent(bucket, new ConcurrentSkipListMap<>());
    }

    /**
     * Store an object directly, bypassing the upload path
     */
    public void put(String bucket, String key, byte[] data) {
        buckets.computeIfAbsent(bucket, name -> new ConcurrentSkipListMap<>()).put(key, data);
    }

    @Override
    public DriverContext getDriverContext() {
        return context;
    }

    @Override
    public String getDriverType() {
        return "stub";
    }

    @Override
    public String getDriverName() {
        return "stub";
    }

    private NavigableMap<String, byte[]> bucket(String name) {
        NavigableMap<String, byte[]> objects = buckets.get(name);
        if (objects == null) {
            throw new BucketNotFoundException(name);
        }
        return objects;
    }

    private ListObjectsPage list(ListObjectsOperation op) {
        NavigableMap<String, byte[]> objects = bucket(op.getBucketName());
        NavigableMap<String, byte[]> tail = op.getContinuationToken() != null
                ? objects.tailMap(op.getContinuationToken(), false)
                : objects.tailMap(op.getPrefix(), true);
        List<StorageObject> page = new ArrayList<>();
        String last = null;
        for (Map.Entry<String, byte[]> entry : tail.entrySet()) {
            if (!entry.getKey().startsWith(op.getPrefix())) {
                break;
            }
            if (page.size() == Math.min(pageSize, op.getMaxKeys())) {
                return ListObjectsPage.builder().objects(page).nextContinuationToken(last).build();
            }
            page.add(object(op.getBucketName(), entry.getKey(), entry.getValue()));
            last = entry.getKey();
        }
        return ListObjectsPage.builder().objects(page).build();
    }

    private Mono<StorageObject> transfer(String key, Callable<StorageObject> work) {
        return Mono.defer(() -> {
            transferCalls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Mono<Long> delay = latency.isZero() ? Mono.just(0L) : Mono.delay(latency);
            return delay
                    .then(Mono.fromCallable(() -> {
                        if (failingKeys.contains(key)) {
                            throw new CloudBulkException("InjectedFailure", "Injected failure for " + key, 500);
                        }
                        return work.call();
                    }).subscribeOn(Schedulers.boundedElastic()))
                    // released before the result reaches the subscriber, which may start the next transfer
                    .doOnSuccess(object -> inFlight.decrementAndGet())
                    .doOnError(e -> inFlight.decrementAndGet())
                    .doOnCancel(inFlight::decrementAndGet);
        });
    }

    private static StorageObject object(String bucket, String key, byte[] data) {
        return StorageObject.builder()
                .bucketName(bucket)
                .key(key)
                .size((long) data.length)
                .lastModified(Instant.now())
                .build();
    }

    private <O extends Operation<R>, R> void on(Class<O> type, Capability capability, Function<O, Mono<R>> body) {
        getHandlerRegistry().register(new OperationHandler<O, R>() {
            @Override
            public Mono<R> handle(O operation, DriverContext ctx) {
                return body.apply(operation);
            }

            @Override
            public Class<O> getOperationType() {
                return type;
            }

            @Override
            public Set<Capability> getProvidedCapabilities() {
                return Set.of(capability);
            }
        });
    }

    private static class StubContext implements DriverContext {

        private final DriverConfig config = DriverConfig.of("stub", "stub", null);

        private OperationHandlerRegistry handlerRegistry;

        @Override
        public DriverConfig getConfig() {
            return config;
        }

        @Override
        public String getDriverName() {
            return "stub";
        }

        @Override
        public String getDriverType() {
            return "stub";
        }

        @Override
        public OperationHandlerRegistry getHandlerRegistry() {
            return handlerRegistry;
        }

        @Override
        public void setHandlerRegistry(OperationHandlerRegistry registry) {
            this.handlerRegistry = registry;
        }
    }
}
