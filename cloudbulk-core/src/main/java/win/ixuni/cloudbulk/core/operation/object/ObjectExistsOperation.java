package win.ixuni.cloudbulk.core.operation.object;

import lombok.Value;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

/**
 * Object existence check
 */
@Value
public class ObjectExistsOperation implements Operation<Boolean>, BucketScoped {

    String bucketName;

    String key;
}
