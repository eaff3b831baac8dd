package win.ixuni.cloudbulk.runner.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.cloudbulk.core.transfer.FailurePolicy;
import win.ixuni.cloudbulk.core.transfer.TransferOptions;

import static org.junit.jupiter.api.Assertions.*;

class CloudBulkPropertiesTest {

    @Test
    @DisplayName("Default cleanup removes everything")
    void testCleanup_Defaults() {
        CloudBulkProperties.Cleanup cleanup = new CloudBulkProperties.Cleanup();

        assertTrue(cleanup.shouldDeleteObjects());
        assertTrue(cleanup.shouldDeleteBuckets());
        assertTrue(cleanup.shouldDeleteLocalFiles());
    }

    @Test
    @DisplayName("Disabled cleanup keeps everything")
    void testCleanup_Disabled() {
        CloudBulkProperties.Cleanup cleanup = new CloudBulkProperties.Cleanup();
        cleanup.setEnabled(false);

        assertFalse(cleanup.shouldDeleteObjects());
        assertFalse(cleanup.shouldDeleteBuckets());
        assertFalse(cleanup.shouldDeleteLocalFiles());
    }

    @Test
    @DisplayName("Keeping data also keeps buckets")
    void testCleanup_KeepData() {
        CloudBulkProperties.Cleanup cleanup = new CloudBulkProperties.Cleanup();
        cleanup.setKeepData(true);

        assertFalse(cleanup.shouldDeleteObjects());
        assertFalse(cleanup.shouldDeleteBuckets());
        assertTrue(cleanup.shouldDeleteLocalFiles());
    }

    @Test
    @DisplayName("Keeping buckets still empties them")
    void testCleanup_KeepBuckets() {
        CloudBulkProperties.Cleanup cleanup = new CloudBulkProperties.Cleanup();
        cleanup.setKeepBuckets(true);
        cleanup.setKeepLocalFiles(true);

        assertTrue(cleanup.shouldDeleteObjects());
        assertFalse(cleanup.shouldDeleteBuckets());
        assertFalse(cleanup.shouldDeleteLocalFiles());
    }

    @Test
    @DisplayName("Transfer section maps onto transfer options")
    void testTransfer_ToOptions() {
        CloudBulkProperties.Transfer transfer = new CloudBulkProperties.Transfer();
        transfer.setConcurrency(12);
        transfer.setFailurePolicy(FailurePolicy.FAIL_FAST);
        transfer.setOverwrite(false);

        TransferOptions options = transfer.toOptions();

        assertEquals(12, options.getConcurrency());
        assertEquals(FailurePolicy.FAIL_FAST, options.getFailurePolicy());
        assertFalse(options.isOverwrite());
        assertFalse(options.isVerbose());
    }
}
