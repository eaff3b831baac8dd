package win.ixuni.cloudbulk.core.operation.bucket;

import lombok.Value;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

/**
 * Bucket existence check
 */
@Value
public class BucketExistsOperation implements Operation<Boolean>, BucketScoped {

    String bucketName;
}
