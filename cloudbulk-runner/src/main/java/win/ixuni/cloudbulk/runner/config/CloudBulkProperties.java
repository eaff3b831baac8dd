package win.ixuni.cloudbulk.runner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.transfer.FailurePolicy;
import win.ixuni.cloudbulk.core.transfer.TransferOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * CloudBulk runner configuration
 */
@Data
@ConfigurationProperties(prefix = "cloudbulk")
public class CloudBulkProperties {

    /**
     * List of driver configurations
     */
    private List<DriverConfig> drivers = new ArrayList<>();

    /**
     * Driver used when a command does not name one
     */
    private String defaultDriver;

    private Transfer transfer = new Transfer();

    private Cleanup cleanup = new Cleanup();

    private Benchmark benchmark = new Benchmark();

    /**
     * Bulk transfer defaults
     */
    @Data
    public static class Transfer {

        private int concurrency = TransferOptions.DEFAULT_CONCURRENCY;

        private FailurePolicy failurePolicy = FailurePolicy.FAIL_AT_END;

        private boolean verbose = false;

        private boolean overwrite = true;

        public TransferOptions toOptions() {
            return TransferOptions.builder()
                    .concurrency(concurrency)
                    .failurePolicy(failurePolicy)
                    .verbose(verbose)
                    .overwrite(overwrite)
                    .build();
        }
    }

    /**
     * What the demo, benchmark and compare commands remove when they finish
     */
    @Data
    public static class Cleanup {

        /**
         * Master switch, false keeps everything
         */
        private boolean enabled = true;

        /**
         * Keep uploaded objects (and so their buckets)
         */
        private boolean keepData = false;

        /**
         * Empty buckets but do not delete them
         */
        private boolean keepBuckets = false;

        /**
         * Keep generated local files
         */
        private boolean keepLocalFiles = false;

        public boolean shouldDeleteObjects() {
            return enabled && !keepData;
        }

        public boolean shouldDeleteBuckets() {
            return shouldDeleteObjects() && !keepBuckets;
        }

        public boolean shouldDeleteLocalFiles() {
            return enabled && !keepLocalFiles;
        }
    }

    /**
     * Benchmark defaults
     */
    @Data
    public static class Benchmark {

        private int fileCount = 100;

        private int fileSizeKb = 64;

        /**
         * Worker counts measured against the sequential baseline
         */
        private List<Integer> concurrencies = new ArrayList<>(List.of(10, 50, 100));

        /**
         * JSON report location, none when empty
         */
        private String reportPath = "benchmark-report.json";
    }
}
