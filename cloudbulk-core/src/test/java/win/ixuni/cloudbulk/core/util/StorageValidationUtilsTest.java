package win.ixuni.cloudbulk.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class StorageValidationUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {"abc", "my-bucket", "my.bucket.2024", "data_lake-01", "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa"})
    void testValidNames(String name) {
        assertNull(StorageValidationUtils.validateBucketName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "My-Bucket", "-bucket", "bucket-", "bu..cket", "192.168.1.1", "has space"})
    void testInvalidNames(String name) {
        assertNotNull(StorageValidationUtils.validateBucketName(name));
    }

    @Test
    void testNullAndTooLong() {
        assertNotNull(StorageValidationUtils.validateBucketName(null));
        assertNotNull(StorageValidationUtils.validateBucketName("a".repeat(64)));
    }
}
