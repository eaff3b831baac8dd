package win.ixuni.cloudbulk.runner.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Generates local files for demos and benchmarks
 */
@Slf4j
public final class LocalTestData {

    private LocalTestData() {
    }

    /**
     * Create {@code count} files of {@code sizeBytes} random bytes each, spread over
     * {@code subdirectories} nested directories
     *
     * @return created files, in creation order
     */
    public static List<Path> createFiles(Path root, int count, int sizeBytes, int subdirectories) throws IOException {
        Random random = new Random(count * 31L + sizeBytes);
        List<Path> files = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Path dir = subdirectories > 0
                    ? root.resolve("dir_" + (i % subdirectories))
                    : root;
            Files.createDirectories(dir);
            byte[] data = new byte[sizeBytes];
            random.nextBytes(data);
            files.add(Files.write(dir.resolve(String.format("file_%04d.bin", i)), data));
        }
        log.debug("Created {} files of {} bytes under {}", count, sizeBytes, root);
        return files;
    }

    /**
     * Small mixed tree used by the demo: text files at the root and in nested directories
     */
    public static List<Path> createDemoTree(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        files.add(write(root.resolve("readme.txt"), "CloudBulk demo data\n"));
        for (int i = 1; i <= 3; i++) {
            files.add(write(root.resolve("docs").resolve("doc_" + i + ".txt"), "document " + i + "\n"));
        }
        for (int i = 1; i <= 3; i++) {
            files.add(write(root.resolve("data").resolve("nested").resolve("record_" + i + ".csv"),
                    "id,value\n" + i + "," + (i * 100) + "\n"));
        }
        return files;
    }

    /**
     * Delete a directory tree, ignoring a missing root
     */
    public static void deleteTree(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
