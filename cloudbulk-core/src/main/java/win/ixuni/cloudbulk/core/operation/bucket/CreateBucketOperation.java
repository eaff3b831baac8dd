package win.ixuni.cloudbulk.core.operation.bucket;

import lombok.Value;
import win.ixuni.cloudbulk.core.model.StorageBucket;
import win.ixuni.cloudbulk.core.operation.BucketScoped;
import win.ixuni.cloudbulk.core.operation.Operation;

/**
 * Create bucket operation
 */
@Value
public class CreateBucketOperation implements Operation<StorageBucket>, BucketScoped {

    String bucketName;
}
