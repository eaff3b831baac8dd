package win.ixuni.cloudbulk.core.transfer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.driver.StorageDriver;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BulkTransferException;
import win.ixuni.cloudbulk.core.exception.CapabilityNotSupportedException;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.core.exception.InvalidBucketNameException;
import win.ixuni.cloudbulk.core.exception.InvalidObjectKeyException;
import win.ixuni.cloudbulk.core.exception.LocalFileNotFoundException;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.model.StorageTransferPath;
import win.ixuni.cloudbulk.core.model.TransferDirection;
import win.ixuni.cloudbulk.core.model.TransferItemResult;
import win.ixuni.cloudbulk.core.operation.bucket.BucketExistsOperation;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;
import win.ixuni.cloudbulk.core.util.StoragePaths;
import win.ixuni.cloudbulk.core.util.StorageValidationUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Bulk transfer service
 * <p>
 * Fans a list of transfer paths out over a storage driver with at most
 * {@link TransferOptions#getConcurrency()} items in flight, and collects one
 * {@link TransferItemResult} per item in submission order. Also offers the directory-level and
 * bucket-level helpers built on top of the driver operations.
 * <p>
 * Every method is lazy: nothing happens until the returned publisher is subscribed.
 *
 * <pre>
 * BulkTransferService service = new BulkTransferService(driver, TransferOptions.defaults());
 * BulkTransferResult result = service.uploadDirectory("my-bucket", Path.of("data"), "backup/data").block();
 * </pre>
 */
@Slf4j
public class BulkTransferService {

    @Getter
    private final StorageDriver driver;

    @Getter
    private final TransferOptions options;

    public BulkTransferService(StorageDriver driver) {
        this(driver, TransferOptions.defaults());
    }

    public BulkTransferService(StorageDriver driver, TransferOptions options) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.options = Objects.requireNonNull(options, "options");
        if (options.getConcurrency() < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + options.getConcurrency());
        }
    }

    /**
     * Same driver, different options
     */
    public BulkTransferService withOptions(TransferOptions options) {
        return new BulkTransferService(driver, options);
    }

    // ==================== Bulk transfer ====================

    /**
     * Upload every local file to its storage path
     */
    public Mono<BulkTransferResult> upload(String bucket, List<StorageTransferPath> paths) {
        return transfer(TransferDirection.UPLOAD, bucket, paths, this::uploadOne);
    }

    /**
     * Download every storage path to its local file
     */
    public Mono<BulkTransferResult> download(String bucket, List<StorageTransferPath> paths) {
        return transfer(TransferDirection.DOWNLOAD, bucket, paths, this::downloadOne);
    }

    /**
     * Upload all regular files under {@code localDir}, keyed by their path relative to it
     * under {@code storageDir}
     */
    public Mono<BulkTransferResult> uploadDirectory(String bucket, Path localDir, String storageDir) {
        return Mono.fromCallable(() -> collectUploadPaths(localDir, storageDir))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(paths -> {
                    log.info("Uploading {} files from {} to {}/{}", paths.size(), localDir, bucket,
                            StoragePaths.normalizeDirectory(storageDir));
                    return upload(bucket, paths);
                });
    }

    /**
     * Download every object under the {@code storageDir} directory into {@code localDir},
     * mirroring the key structure. Directory markers are skipped.
     */
    public Mono<BulkTransferResult> downloadDirectory(String bucket, String storageDir, Path localDir) {
        String prefix = StoragePaths.directoryPrefix(storageDir);
        return streamObjects(bucket, prefix)
                .map(StorageObject::getKey)
                .filter(key -> !StoragePaths.isDirectoryMarker(key))
                .map(key -> new StorageTransferPath(StoragePaths.toLocalPath(localDir, key, prefix), key))
                .collectList()
                .flatMap(paths -> {
                    log.info("Downloading {} objects from {}/{} to {}", paths.size(), bucket, prefix, localDir);
                    return download(bucket, paths);
                });
    }

    /**
     * Upload a flat list of files, each stored under its file name at the bucket root
     * <p>
     * A path without a file name (a file system root) signals {@link InvalidObjectKeyException}.
     */
    public Mono<BulkTransferResult> uploadFiles(String bucket, List<Path> files) {
        return Mono.defer(() -> {
            for (Path file : files) {
                if (file.getFileName() == null) {
                    return Mono.error(new InvalidObjectKeyException(file.toString(), "path has no file name"));
                }
            }
            List<StorageTransferPath> paths = files.stream()
                    .map(file -> new StorageTransferPath(file, file.getFileName().toString()))
                    .collect(Collectors.toList());
            return upload(bucket, paths);
        });
    }

    // ==================== Listing and checks ====================

    /**
     * Keys of all objects under a storage directory ("" for the whole bucket)
     */
    public Mono<List<String>> listObjects(String bucket, String storageDir) {
        return streamObjects(bucket, StoragePaths.directoryPrefix(storageDir))
                .map(StorageObject::getKey)
                .collectList();
    }

    /**
     * All objects whose key starts with {@code prefix}, following continuation tokens
     */
    public Flux<StorageObject> streamObjects(String bucket, String prefix) {
        return listPage(bucket, prefix, null)
                .expand(page -> page.hasMore()
                        ? listPage(bucket, prefix, page.getNextContinuationToken())
                        : Mono.empty())
                .flatMapIterable(ListObjectsPage::getObjects);
    }

    public Mono<Boolean> objectExists(String bucket, String key) {
        return driver.execute(new ObjectExistsOperation(bucket, key));
    }

    public Mono<Boolean> bucketExists(String bucket) {
        return driver.execute(new BucketExistsOperation(bucket));
    }

    // ==================== Bucket management ====================

    /**
     * Create a bucket unless it already exists
     *
     * @return true when the bucket was created, false when it already existed
     */
    public Mono<Boolean> createBucket(String bucket) {
        String error = StorageValidationUtils.validateBucketName(bucket);
        if (error != null) {
            return Mono.error(new InvalidBucketNameException(bucket, error));
        }
        return bucketExists(bucket)
                .flatMap(exists -> {
                    if (exists) {
                        log.info("Bucket '{}' already exists", bucket);
                        return Mono.just(false);
                    }
                    return driver.execute(new CreateBucketOperation(bucket))
                            .doOnNext(created -> log.info("Created bucket '{}'", bucket))
                            .thenReturn(true)
                            .onErrorResume(BucketAlreadyExistsException.class, e -> Mono.just(false));
                });
    }

    /**
     * Delete every object in a bucket
     *
     * @return number of objects deleted
     */
    public Mono<Integer> emptyBucket(String bucket) {
        if (!driver.supports(Capability.BATCH_DELETE)) {
            return Mono.error(new CapabilityNotSupportedException(Capability.BATCH_DELETE, driver.getDriverName()));
        }
        return streamObjects(bucket, "")
                .map(StorageObject::getKey)
                .collectList()
                .flatMapMany(Flux::fromIterable)
                .buffer(DeleteObjectsOperation.MAX_BATCH_SIZE)
                .concatMap(batch -> driver.execute(new DeleteObjectsOperation(bucket, batch)))
                .reduce(0, Integer::sum)
                .doOnNext(count -> log.info("Deleted {} objects from bucket '{}'", count, bucket));
    }

    /**
     * Delete a bucket, emptying it first when {@code force} is set
     */
    public Mono<Void> deleteBucket(String bucket, boolean force) {
        Mono<Void> delete = driver.execute(new DeleteBucketOperation(bucket))
                .doOnSuccess(v -> log.info("Deleted bucket '{}'", bucket));
        return force ? emptyBucket(bucket).then(delete) : delete;
    }

    // ==================== Internals ====================

    private Mono<BulkTransferResult> transfer(
            TransferDirection direction,
            String bucket,
            List<StorageTransferPath> paths,
            BiFunction<String, StorageTransferPath, Mono<TransferItemResult>> itemTransfer) {

        if (paths == null || paths.isEmpty()) {
            return Mono.just(BulkTransferResult.empty(direction, bucket));
        }

        return Mono.defer(() -> {
            final long startTime = System.nanoTime();

            Flux<Tuple2<Long, TransferItemResult>> results = Flux.fromIterable(paths)
                    .index()
                    .flatMap(indexed -> itemTransfer.apply(bucket, indexed.getT2())
                                    .map(item -> Tuples.of(indexed.getT1(), item)),
                            options.getConcurrency());

            if (options.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                results = results.takeUntil(indexed -> !indexed.getT2().isSuccess());
            }

            return results.collectList().flatMap(collected -> {
                BulkTransferResult result = BulkTransferResult.builder()
                        .direction(direction)
                        .bucket(bucket)
                        .items(collected.stream()
                                .sorted(Comparator.comparingLong(Tuple2::getT1))
                                .map(Tuple2::getT2)
                                .collect(Collectors.toList()))
                        .duration(Duration.ofNanos(System.nanoTime() - startTime))
                        .build();
                logSummary(result, paths.size());

                if (!result.isSuccessful() && options.getFailurePolicy() != FailurePolicy.COLLECT) {
                    return Mono.error(new BulkTransferException(result));
                }
                return Mono.just(result);
            });
        });
    }

    private Mono<TransferItemResult> uploadOne(String bucket, StorageTransferPath path) {
        return Mono.defer(() -> {
            final long startTime = System.nanoTime();
            Path source = path.getLocalPath();

            return Mono.fromCallable(() -> {
                        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
                            throw new LocalFileNotFoundException(source);
                        }
                        return Files.size(source);
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(size -> driver.execute(UploadFileOperation.builder()
                                    .bucketName(bucket)
                                    .key(path.getStoragePath())
                                    .source(source)
                                    .build())
                            .thenReturn(size))
                    .map(size -> completed(TransferDirection.UPLOAD, path, size, startTime))
                    .onErrorResume(e -> Mono.just(failed(TransferDirection.UPLOAD, path, e, startTime)));
        });
    }

    private Mono<TransferItemResult> downloadOne(String bucket, StorageTransferPath path) {
        return Mono.defer(() -> {
            final long startTime = System.nanoTime();
            Path destination = path.getLocalPath().toAbsolutePath();

            return Mono.fromCallable(() -> {
                        if (!options.isOverwrite() && Files.exists(destination)) {
                            throw new CloudBulkException("LocalFileExists",
                                    "Local file already exists: " + destination, 409,
                                    new FileAlreadyExistsException(destination.toString()));
                        }
                        Path parent = destination.getParent();
                        if (parent != null) {
                            Files.createDirectories(parent);
                        }
                        return destination;
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(target -> driver.execute(
                            new DownloadFileOperation(bucket, path.getStoragePath(), target)))
                    .map(object -> object.getSize() != null ? object.getSize() : sizeOf(destination))
                    .map(size -> completed(TransferDirection.DOWNLOAD, path, size, startTime))
                    .onErrorResume(e -> Mono.just(failed(TransferDirection.DOWNLOAD, path, e, startTime)));
        });
    }

    private TransferItemResult completed(TransferDirection direction, StorageTransferPath path,
                                         long bytes, long startTime) {
        TransferItemResult item = TransferItemResult.success(path, bytes, Duration.ofNanos(System.nanoTime() - startTime));
        if (options.isVerbose()) {
            log.info("{} {} ({} bytes, {}ms)", verb(direction), path, bytes, item.getElapsed().toMillis());
        } else {
            log.debug("{} {} ({} bytes, {}ms)", verb(direction), path, bytes, item.getElapsed().toMillis());
        }
        return item;
    }

    private TransferItemResult failed(TransferDirection direction, StorageTransferPath path,
                                      Throwable error, long startTime) {
        TransferItemResult item = TransferItemResult.failure(path, error, Duration.ofNanos(System.nanoTime() - startTime));
        if (options.isVerbose()) {
            log.warn("Failed {} of {}: {}", direction.name().toLowerCase(), path, error.getMessage());
        } else {
            log.debug("Failed {} of {}: {}", direction.name().toLowerCase(), path, error.getMessage());
        }
        return item;
    }

    private void logSummary(BulkTransferResult result, int submitted) {
        log.info("{} {} of {} items ({} failed, {} bytes) {} bucket '{}' in {}ms, {} MB/s",
                verb(result.getDirection()), result.getSucceededCount(), submitted, result.getFailedCount(),
                result.getTotalBytes(), result.getDirection() == TransferDirection.UPLOAD ? "to" : "from",
                result.getBucket(), result.getDuration().toMillis(),
                String.format("%.2f", result.getThroughputMbPerSecond()));
    }

    private Mono<ListObjectsPage> listPage(String bucket, String prefix, String continuationToken) {
        return driver.execute(ListObjectsOperation.builder()
                .bucketName(bucket)
                .prefix(prefix)
                .continuationToken(continuationToken)
                .build());
    }

    private static List<StorageTransferPath> collectUploadPaths(Path localDir, String storageDir) throws IOException {
        if (!Files.isDirectory(localDir)) {
            throw new LocalFileNotFoundException(localDir);
        }
        try (Stream<Path> files = Files.walk(localDir)) {
            return files.filter(Files::isRegularFile)
                    .sorted()
                    .map(file -> new StorageTransferPath(file, StoragePaths.toKey(localDir, file, storageDir)))
                    .collect(Collectors.toList());
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String verb(TransferDirection direction) {
        return direction == TransferDirection.UPLOAD ? "Uploaded" : "Downloaded";
    }
}
