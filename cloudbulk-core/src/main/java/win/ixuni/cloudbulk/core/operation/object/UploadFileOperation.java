package win.ixuni.cloudbulk.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

import java.nio.file.Path;

/**
 * Upload one local file to an object key
 */
@Value
@Builder
public class UploadFileOperation implements Operation<StorageObject>, BucketScoped {

    String bucketName;

    String key;

    /**
     * Source file, must be a readable regular file
     */
    Path source;

    /**
     * Content type, null lets the backend decide
     */
    String contentType;
}
