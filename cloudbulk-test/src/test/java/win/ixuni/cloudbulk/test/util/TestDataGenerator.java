package win.ixuni.cloudbulk.test.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Writes local test trees and computes checksums
 */
public final class TestDataGenerator {

    private TestDataGenerator() {
    }

    /**
     * Local file with the bytes written to it
     */
    public record TestFile(Path path, String relativeKey, byte[] content) {
    }

    /**
     * Write {@code count} random files of {@code size} bytes, every third one in a nested directory
     */
    public static List<TestFile> writeTree(Path root, int count, int size, long seed) throws IOException {
        Random random = new Random(seed);
        List<TestFile> files = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String relative = switch (i % 3) {
                case 0 -> String.format("file_%03d.bin", i);
                case 1 -> String.format("level1/file_%03d.bin", i);
                default -> String.format("level1/level2/file_%03d.bin", i);
            };
            byte[] content = new byte[size];
            random.nextBytes(content);
            Path path = root.resolve(relative);
            Files.createDirectories(path.getParent());
            Files.write(path, content);
            files.add(new TestFile(path, relative, content));
        }
        return files;
    }

    public static String md5(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public static String randomBucketName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
