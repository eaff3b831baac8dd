package win.ixuni.cloudbulk.core.model;

import org.junit.jupiter.api.Test;
import win.ixuni.cloudbulk.core.exception.BulkTransferException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BulkTransferResultTest {

    private static final StorageTransferPath A = StorageTransferPath.of("a.bin", "a.bin");
    private static final StorageTransferPath B = StorageTransferPath.of("b.bin", "b.bin");

    @Test
    void testAggregates() {
        BulkTransferResult result = BulkTransferResult.builder()
                .direction(TransferDirection.UPLOAD)
                .bucket("bucket")
                .item(TransferItemResult.success(A, 1024 * 1024, Duration.ofMillis(100)))
                .item(TransferItemResult.failure(B, new RuntimeException("boom"), Duration.ofMillis(5)))
                .duration(Duration.ofMillis(500))
                .build();

        assertEquals(1, result.getSucceededCount());
        assertEquals(1, result.getFailedCount());
        assertEquals(1024 * 1024, result.getTotalBytes());
        assertEquals(2.0, result.getThroughputMbPerSecond(), 0.0001);
        assertFalse(result.isSuccessful());
        assertEquals(B, result.failures().get(0).getPath());

        BulkTransferException error = assertThrows(BulkTransferException.class, result::throwIfFailed);
        assertSame(result, error.getResult());
        assertEquals("boom", error.getCause().getMessage());
        assertEquals("1 of 2 items failed during upload to bucket 'bucket'", error.getMessage());
    }

    @Test
    void testEmpty() {
        BulkTransferResult result = BulkTransferResult.empty(TransferDirection.DOWNLOAD, "bucket");

        assertTrue(result.isSuccessful());
        assertEquals(0.0, result.getThroughputMbPerSecond());
        assertSame(result, result.throwIfFailed());
    }

    @Test
    void testTransferPathRequiresKey() {
        assertThrows(IllegalArgumentException.class, () -> StorageTransferPath.of("a.bin", " "));
        assertThrows(NullPointerException.class, () -> StorageTransferPath.of(null, "a.bin"));
    }
}
