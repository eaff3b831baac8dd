package win.ixuni.cloudbulk.runner.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.core.model.TransferDirection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Benchmark results of one driver, serialized as the JSON report
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkReport {

    private String driver;

    private String driverType;

    private int fileCount;

    private long fileSizeBytes;

    private Instant startedAt;

    @Builder.Default
    private List<Run> runs = new ArrayList<>();

    /**
     * One measured transfer
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Run {

        private String label;

        private TransferDirection direction;

        private int concurrency;

        private int succeeded;

        private int failed;

        private long bytes;

        private long durationMs;

        private double throughputMbPerSecond;

        /**
         * Sequential duration divided by this duration, null without a baseline
         */
        private Double speedup;

        public static Run of(String label, int concurrency, BulkTransferResult result) {
            return Run.builder()
                    .label(label)
                    .direction(result.getDirection())
                    .concurrency(concurrency)
                    .succeeded(result.getSucceededCount())
                    .failed(result.getFailedCount())
                    .bytes(result.getTotalBytes())
                    .durationMs(result.getDuration().toMillis())
                    .throughputMbPerSecond(result.getThroughputMbPerSecond())
                    .build();
        }
    }
}
