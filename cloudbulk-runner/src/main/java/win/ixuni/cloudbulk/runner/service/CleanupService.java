package win.ixuni.cloudbulk.runner.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import win.ixuni.cloudbulk.core.transfer.BulkTransferService;
import win.ixuni.cloudbulk.runner.config.CloudBulkProperties;

import java.nio.file.Path;

/**
 * Removes what demo, benchmark and compare runs leave behind, as far as
 * {@code cloudbulk.cleanup.*} allows
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CleanupService {

    private final CloudBulkProperties properties;

    /**
     * Clean up a bucket used by a run
     */
    public void cleanupBucket(BulkTransferService service, String bucket) {
        CloudBulkProperties.Cleanup cleanup = properties.getCleanup();
        if (!cleanup.shouldDeleteObjects()) {
            log.info("Keeping data in bucket '{}' (cleanup enabled: {}, keep-data: {})",
                    bucket, cleanup.isEnabled(), cleanup.isKeepData());
            return;
        }
        try {
            if (cleanup.shouldDeleteBuckets()) {
                service.deleteBucket(bucket, true).block();
            } else {
                Integer deleted = service.emptyBucket(bucket).block();
                log.info("Emptied bucket '{}' ({} objects), keeping the bucket", bucket, deleted);
            }
        } catch (RuntimeException e) {
            log.warn("Cleanup of bucket '{}' failed: {}", bucket, e.getMessage());
        }
    }

    /**
     * Clean up generated local files
     */
    public void cleanupLocal(Path root) {
        if (!properties.getCleanup().shouldDeleteLocalFiles()) {
            log.info("Keeping local files under {}", root);
            return;
        }
        try {
            LocalTestData.deleteTree(root);
            log.debug("Deleted local files under {}", root);
        } catch (RuntimeException e) {
            log.warn("Cleanup of {} failed: {}", root, e.getMessage());
        }
    }
}
