package win.ixuni.cloudbulk.core.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One transfer item: a local file and the object key it maps to
 */
@Value
public class StorageTransferPath {

    /**
     * Local filesystem path (source for uploads, destination for downloads)
     */
    Path localPath;

    /**
     * Object key inside the bucket / container
     */
    String storagePath;

    public StorageTransferPath(Path localPath, String storagePath) {
        Objects.requireNonNull(localPath, "localPath");
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("storagePath must not be blank (local path: " + localPath + ")");
        }
        this.localPath = localPath;
        this.storagePath = storagePath;
    }

    public static StorageTransferPath of(String localPath, String storagePath) {
        Objects.requireNonNull(localPath, "localPath");
        return new StorageTransferPath(Path.of(localPath), storagePath);
    }

    @Override
    public String toString() {
        return localPath + " <-> " + storagePath;
    }
}
