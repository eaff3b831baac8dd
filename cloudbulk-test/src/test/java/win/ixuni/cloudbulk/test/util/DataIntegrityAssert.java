package win.ixuni.cloudbulk.test.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Content assertions with useful diagnostics on mismatch
 */
public final class DataIntegrityAssert {

    private DataIntegrityAssert() {
    }

    public static void assertContentEquals(byte[] expected, byte[] actual, String message) {
        assertNotNull(actual, message + ": actual content is null");
        if (expected.length != actual.length) {
            fail(String.format("%s: size mismatch, expected %d bytes but got %d",
                    message, expected.length, actual.length));
        }
        for (int i = 0; i < expected.length; i++) {
            if (expected[i] != actual[i]) {
                fail(String.format("%s: content differs at byte %d (expected 0x%02X, got 0x%02X)",
                        message, i, expected[i] & 0xFF, actual[i] & 0xFF));
            }
        }
        assertEquals(TestDataGenerator.md5(expected), TestDataGenerator.md5(actual), message + ": MD5 mismatch");
    }

    /**
     * Every file of the generated tree exists under {@code restoredRoot} with identical bytes
     */
    public static void assertTreeRestored(List<TestDataGenerator.TestFile> files, Path restoredRoot) throws IOException {
        for (TestDataGenerator.TestFile file : files) {
            Path restored = restoredRoot.resolve(file.relativeKey());
            assertTrue(Files.isRegularFile(restored), "Missing restored file " + restored);
            assertContentEquals(file.content(), Files.readAllBytes(restored), file.relativeKey());
        }
    }
}
