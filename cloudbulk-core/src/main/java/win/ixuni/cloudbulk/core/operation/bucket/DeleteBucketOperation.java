package win.ixuni.cloudbulk.core.operation.bucket;

import lombok.Value;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

/**
 * Delete bucket operation (the bucket must be empty)
 */
@Value
public class DeleteBucketOperation implements Operation<Void>, BucketScoped {

    String bucketName;
}
