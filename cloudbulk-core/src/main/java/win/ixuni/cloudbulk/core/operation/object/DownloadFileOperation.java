package win.ixuni.cloudbulk.core.operation.object;

import lombok.Value;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

import java.nio.file.Path;

/**
 * Download one object to a local file
 * <p>
 * The destination's parent directory exists when the handler runs; an existing file is replaced.
 */
@Value
public class DownloadFileOperation implements Operation<StorageObject>, BucketScoped {

    String bucketName;

    String key;

    Path destination;
}
