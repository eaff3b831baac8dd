package win.ixuni.cloudbulk.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.AbstractMemoryHandler;

import java.nio.file.Files;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory upload handler
 */
public class MemoryUploadFileHandler extends AbstractMemoryHandler<UploadFileOperation, StorageObject> {

    @Override
    protected Mono<StorageObject> doHandle(UploadFileOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        MemoryDriverContext.BucketData bucket = context.requireBucket(bucketName);

        return Mono.fromCallable(() -> Files.readAllBytes(operation.getSource()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(data -> {
                    MemoryDriverContext.ObjectData object = MemoryDriverContext.ObjectData.builder()
                            .key(operation.getKey())
                            .data(data)
                            .etag("\"" + calculateMd5(data) + "\"")
                            .contentType(operation.getContentType() != null ? operation.getContentType()
                                    : "application/octet-stream")
                            .lastModified(Instant.now())
                            .build();
                    bucket.getObjects().put(operation.getKey(), object);
                    return toStorageObject(bucketName, object);
                });
    }

    private String calculateMd5(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(data);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
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
