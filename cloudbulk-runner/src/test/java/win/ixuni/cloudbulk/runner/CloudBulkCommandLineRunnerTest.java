package win.ixuni.cloudbulk.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import picocli.CommandLine;
import win.ixuni.cloudbulk.runner.service.LocalTestData;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the command tree against the in-memory drivers from the test configuration
 */
@SpringBootTest
class CloudBulkCommandLineRunnerTest {

    @Autowired
    private CloudBulkCommandLineRunner runner;

    @Autowired
    private ApplicationContext applicationContext;

    @TempDir
    Path tempDir;

    private record Execution(int exitCode, String out, String err) {
    }

    private Execution run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = runner.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        int exitCode = commandLine.execute(args);
        return new Execution(exitCode, out.toString(), err.toString());
    }

    @Test
    @DisplayName("Commands are created by the single picocli factory from the starter")
    void testSingleCommandFactory() {
        assertEquals(1, applicationContext.getBeansOfType(CommandLine.IFactory.class).size());
        assertEquals(0, run("create-bucket", "cmd-factory").exitCode());
        run("delete-bucket", "cmd-factory");
    }

    @Test
    @DisplayName("No subcommand prints usage")
    void testNoSubcommand_PrintsUsage() {
        Execution execution = run();

        assertEquals(CommandLine.ExitCode.USAGE, execution.exitCode());
        assertTrue(execution.err().contains("Usage: cloudbulk"));
    }

    @Test
    @DisplayName("Unknown driver is reported with its error code")
    void testUnknownDriver() {
        Execution execution = run("exists", "-d", "nope", "bucket", "key");

        assertEquals(CommandLine.ExitCode.SOFTWARE, execution.exitCode());
        assertTrue(execution.err().startsWith("Error ["), execution.err());
    }

    @Test
    @DisplayName("Disabled drivers are not registered")
    void testDisabledDriverNotAvailable() {
        Execution execution = run("create-bucket", "-d", "disabled-s3", "some-bucket");

        assertEquals(CommandLine.ExitCode.SOFTWARE, execution.exitCode());
    }

    @Nested
    @DisplayName("Bucket commands")
    class BucketCommands {

        @Test
        @DisplayName("create-bucket reports an existing bucket")
        void testCreateBucket_Twice() {
            Execution first = run("create-bucket", "cmd-create");
            Execution second = run("create-bucket", "cmd-create");

            assertEquals(0, first.exitCode());
            assertTrue(first.out().contains("Created bucket 'cmd-create'"));
            assertEquals(0, second.exitCode());
            assertTrue(second.out().contains("Bucket 'cmd-create' already exists"));
        }

        @Test
        @DisplayName("create-bucket rejects invalid names")
        void testCreateBucket_InvalidName() {
            Execution execution = run("create-bucket", "Bad_Name!");

            assertEquals(CommandLine.ExitCode.SOFTWARE, execution.exitCode());
            assertTrue(execution.err().contains("Error ["));
        }

        @Test
        @DisplayName("delete-bucket needs --force for a non-empty bucket")
        void testDeleteBucket_Force() throws IOException {
            Path source = tempDir.resolve("src");
            LocalTestData.createFiles(source, 3, 64, 1);
            run("create-bucket", "cmd-delete");
            run("upload-dir", "cmd-delete", source.toString());

            Execution refused = run("delete-bucket", "cmd-delete");
            assertEquals(CommandLine.ExitCode.SOFTWARE, refused.exitCode());

            Execution forced = run("delete-bucket", "-f", "cmd-delete");
            assertEquals(0, forced.exitCode());
            assertTrue(forced.out().contains("Deleted bucket 'cmd-delete'"));
            assertTrue(run("exists", "cmd-delete", "anything").err().startsWith("Error ["));
        }

        @Test
        @DisplayName("empty-bucket reports the number of deleted objects")
        void testEmptyBucket() throws IOException {
            Path source = tempDir.resolve("src");
            LocalTestData.createFiles(source, 5, 64, 1);
            run("create-bucket", "cmd-empty");
            run("upload-dir", "cmd-empty", source.toString(), "data");

            Execution execution = run("empty-bucket", "cmd-empty");

            assertEquals(0, execution.exitCode());
            assertTrue(execution.out().contains("Deleted 5 objects from 'cmd-empty'"), execution.out());
            run("delete-bucket", "cmd-empty");
        }
    }

    @Nested
    @DisplayName("Transfer commands")
    class TransferCommands {

        @Test
        @DisplayName("Directory round trip through upload-dir, list, exists and download-dir")
        void testDirectoryRoundTrip() throws IOException {
            Path source = tempDir.resolve("src");
            LocalTestData.createFiles(source, 6, 256, 2);
            run("create-bucket", "cmd-dirs");

            Execution upload = run("upload-dir", "-c", "3", "cmd-dirs", source.toString(), "data");
            assertEquals(0, upload.exitCode(), upload.err());
            assertTrue(upload.out().startsWith("Upload: 6/6 items"), upload.out());

            Execution list = run("list", "cmd-dirs", "data");
            assertEquals(0, list.exitCode());
            assertTrue(list.out().contains("6 objects"));

            Execution longList = run("list", "-l", "cmd-dirs", "data");
            assertTrue(longList.out().contains("256"));

            String firstKey = list.out().lines().findFirst().orElseThrow();
            assertEquals("true", run("exists", "cmd-dirs", firstKey).out().trim());
            assertEquals("false", run("exists", "cmd-dirs", "data/missing").out().trim());

            Path target = tempDir.resolve("restored");
            Execution download = run("download-dir", "cmd-dirs", "data", target.toString());
            assertEquals(0, download.exitCode(), download.err());
            try (var restored = Files.walk(target)) {
                assertEquals(6, restored.filter(Files::isRegularFile).count());
            }
            run("delete-bucket", "-f", "cmd-dirs");
        }

        @Test
        @DisplayName("Explicit LOCAL=KEY pairs upload and download")
        void testPairs() throws IOException {
            Path file = Files.writeString(tempDir.resolve("pair.txt"), "pair content");
            run("create-bucket", "cmd-pairs");

            Execution upload = run("upload", "cmd-pairs", file + "=docs/a.txt");
            assertEquals(0, upload.exitCode(), upload.err());

            Path target = tempDir.resolve("out.txt");
            Execution download = run("download", "cmd-pairs", target + "=docs/a.txt");
            assertEquals(0, download.exitCode(), download.err());
            assertEquals("pair content", Files.readString(target));
            run("delete-bucket", "-f", "cmd-pairs");
        }

        @Test
        @DisplayName("A pair without '=' is a usage error")
        void testInvalidPair() {
            Execution execution = run("upload", "cmd-pairs", "no-separator");

            assertEquals(CommandLine.ExitCode.USAGE, execution.exitCode());
            assertTrue(execution.err().contains("expected LOCAL=KEY"));
        }

        @Test
        @DisplayName("A concurrency below 1 is a usage error and transfers nothing")
        void testZeroConcurrency_UsageError() throws IOException {
            Path source = Files.createDirectories(tempDir.resolve("zero"));
            Files.writeString(source.resolve("a.txt"), "a");
            run("create-bucket", "cmd-zero");

            Execution execution = run("upload-dir", "-c", "0", "cmd-zero", source.toString());

            assertEquals(CommandLine.ExitCode.USAGE, execution.exitCode());
            assertTrue(execution.err().contains("--concurrency"), execution.err());
            assertEquals("false", run("exists", "cmd-zero", "a.txt").out().trim());
            run("delete-bucket", "-f", "cmd-zero");
        }

        @Test
        @DisplayName("Missing local file fails at the end and lists the failure")
        void testMissingLocalFile_FailAtEnd() throws IOException {
            Path file = Files.writeString(tempDir.resolve("present.txt"), "x");
            run("create-bucket", "cmd-fail");

            Execution execution = run("upload", "cmd-fail",
                    file + "=present.txt", tempDir.resolve("absent.txt") + "=absent.txt");

            assertEquals(CommandLine.ExitCode.SOFTWARE, execution.exitCode());
            assertTrue(execution.err().startsWith("Error ["), execution.err());
            assertTrue(execution.err().contains("absent.txt"));
            assertEquals("true", run("exists", "cmd-fail", "present.txt").out().trim());
            run("delete-bucket", "-f", "cmd-fail");
        }

        @Test
        @DisplayName("Collect policy prints the result with failed items")
        void testMissingLocalFile_Collect() {
            run("create-bucket", "cmd-collect");

            Execution execution = run("upload", "--failure-policy", "collect", "cmd-collect",
                    tempDir.resolve("absent.txt") + "=absent.txt");

            assertEquals(CommandLine.ExitCode.SOFTWARE, execution.exitCode());
            assertTrue(execution.out().startsWith("Upload: 0/1 items"), execution.out());
            assertTrue(execution.out().contains("FAILED"));
            run("delete-bucket", "-f", "cmd-collect");
        }
    }

    @Nested
    @DisplayName("Walkthrough commands")
    class WalkthroughCommands {

        @Test
        @DisplayName("demo runs every step and cleans up its bucket")
        void testDemo() {
            Execution execution = run("demo", "-b", "cmd-demo");

            assertEquals(0, execution.exitCode(), execution.out() + execution.err());
            assertTrue(execution.out().contains("Demo completed"));
            assertTrue(execution.out().contains("exists(demo/tree/readme.txt) = true"));
            assertTrue(run("exists", "cmd-demo", "demo/tree/readme.txt").err().startsWith("Error ["));
        }

        @Test
        @DisplayName("benchmark measures the baseline and writes a report")
        void testBenchmark() {
            Path report = tempDir.resolve("benchmark.json");

            Execution execution = run("benchmark", "-b", "cmd-bench", "--files", "3", "--size-kb", "1",
                    "--concurrencies", "2,3", "--report", report.toString());

            assertEquals(0, execution.exitCode(), execution.out() + execution.err());
            assertTrue(execution.out().contains("sequential"));
            assertTrue(execution.out().contains("bulk-3"));
            assertTrue(Files.isRegularFile(report));
        }

        @Test
        @DisplayName("compare prints one row per driver")
        void testCompare() {
            Execution execution = run("compare", "--drivers", "memory,memory-b", "-b", "cmd-compare",
                    "--files", "2", "--size-kb", "1", "-c", "2");

            assertEquals(0, execution.exitCode(), execution.out() + execution.err());
            assertTrue(execution.out().contains("memory-b"));
            assertTrue(execution.out().contains("2 files x 1024 bytes, concurrency 2"));
        }
    }
}
