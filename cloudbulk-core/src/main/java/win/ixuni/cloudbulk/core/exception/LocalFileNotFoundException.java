package win.ixuni.cloudbulk.core.exception;

import java.nio.file.Path;

/**
 * Raised when a local source file or directory does not exist
 */
public class LocalFileNotFoundException extends CloudBulkException {

    public LocalFileNotFoundException(Path path) {
        super("LocalFileNotFound", "Local path does not exist or is not readable: " + path, 404);
    }
}
