package win.ixuni.cloudbulk.runner.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.core.model.TransferDirection;
import win.ixuni.cloudbulk.core.transfer.BulkTransferService;
import win.ixuni.cloudbulk.core.transfer.FailurePolicy;
import win.ixuni.cloudbulk.core.transfer.TransferOptions;
import win.ixuni.cloudbulk.core.util.JsonUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Measures bulk transfers against a sequential baseline
 * <p>
 * Each run uploads the same generated tree under its own prefix and, when enabled,
 * downloads it back. Failed items are counted, not fatal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BenchmarkService {

    private static final String SEQUENTIAL = "sequential";

    private final TransferServiceProvider transferServiceProvider;
    private final CleanupService cleanupService;

    /**
     * Benchmark one driver with every configured worker count
     */
    public BenchmarkReport benchmark(String driverName, BenchmarkSettings settings) throws IOException {
        TransferOptions options = transferServiceProvider.defaultOptions().toBuilder()
                .failurePolicy(FailurePolicy.COLLECT)
                .build();
        BulkTransferService service = transferServiceProvider.forDriver(driverName, options);

        BenchmarkReport report = BenchmarkReport.builder()
                .driver(service.getDriver().getDriverName())
                .driverType(service.getDriver().getDriverType())
                .fileCount(settings.getFileCount())
                .fileSizeBytes(settings.getFileSizeBytes())
                .startedAt(Instant.now())
                .build();

        Path workDir = Files.createTempDirectory("cloudbulk-benchmark-");
        try {
            service.createBucket(settings.getBucket()).block();
            Path source = workDir.resolve("source");
            LocalTestData.createFiles(source, settings.getFileCount(), settings.getFileSizeBytes(), 4);
            log.info("Benchmarking driver '{}' with {} files of {} bytes", report.getDriver(),
                    settings.getFileCount(), settings.getFileSizeBytes());

            if (settings.isIncludeSequential()) {
                report.getRuns().addAll(measure(service, settings, workDir, source, SEQUENTIAL, 1));
            }
            for (int concurrency : settings.getConcurrencies()) {
                report.getRuns().addAll(measure(service, settings, workDir, source, "bulk-" + concurrency, concurrency));
            }
            applySpeedups(report.getRuns());
            return report;
        } finally {
            cleanupService.cleanupBucket(service, settings.getBucket());
            cleanupService.cleanupLocal(workDir);
        }
    }

    /**
     * Run the same workload on several drivers
     */
    public List<BenchmarkReport> compare(List<String> driverNames, BenchmarkSettings settings) throws IOException {
        List<BenchmarkReport> reports = new ArrayList<>();
        for (String driverName : driverNames) {
            reports.add(benchmark(driverName, settings));
        }
        return reports;
    }

    /**
     * Write reports as pretty-printed JSON
     */
    public Path writeReport(Object report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, JsonUtils.toPrettyJson(report));
        log.info("Benchmark report written to {}", target);
        return target;
    }

    private List<BenchmarkReport.Run> measure(BulkTransferService base, BenchmarkSettings settings,
                                              Path workDir, Path source, String label, int concurrency) {
        BulkTransferService service = base.withOptions(base.getOptions().withConcurrency(concurrency));
        String prefix = "benchmark/" + label;
        List<BenchmarkReport.Run> runs = new ArrayList<>();

        BulkTransferResult upload = service.uploadDirectory(settings.getBucket(), source, prefix).block();
        runs.add(BenchmarkReport.Run.of(label, concurrency, upload));

        if (settings.isIncludeDownload()) {
            BulkTransferResult download = service.downloadDirectory(settings.getBucket(), prefix,
                    workDir.resolve("download-" + label)).block();
            runs.add(BenchmarkReport.Run.of(label, concurrency, download));
        }
        return runs;
    }

    private static void applySpeedups(List<BenchmarkReport.Run> runs) {
        for (TransferDirection direction : TransferDirection.values()) {
            BenchmarkReport.Run baseline = runs.stream()
                    .filter(run -> run.getDirection() == direction && SEQUENTIAL.equals(run.getLabel()))
                    .findFirst()
                    .orElse(null);
            if (baseline == null) {
                continue;
            }
            runs.stream()
                    .filter(run -> run.getDirection() == direction)
                    .forEach(run -> run.setSpeedup(
                            (double) Math.max(baseline.getDurationMs(), 1) / Math.max(run.getDurationMs(), 1)));
        }
    }
}
