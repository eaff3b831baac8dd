package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import win.ixuni.cloudbulk.runner.config.CloudBulkProperties;
import win.ixuni.cloudbulk.runner.service.BenchmarkReport;
import win.ixuni.cloudbulk.runner.service.BenchmarkService;
import win.ixuni.cloudbulk.runner.service.BenchmarkSettings;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Sequential baseline versus bulk transfers at several worker counts
 */
@Component
@Scope("prototype")
@Command(name = "benchmark", description = "Measure bulk transfer speedup over sequential transfers")
public class BenchmarkCommand extends AbstractDriverCommand {

    @Option(names = {"-b", "--bucket"}, paramLabel = "BUCKET", defaultValue = "cloudbulk-benchmark",
            description = "Bucket to use (default: ${DEFAULT-VALUE})")
    String bucket;

    @Option(names = "--files", paramLabel = "N", description = "Number of generated files")
    Integer fileCount;

    @Option(names = "--size-kb", paramLabel = "KB", description = "Size of each generated file")
    Integer fileSizeKb;

    @Option(names = "--concurrencies", split = ",", paramLabel = "N",
            description = "Worker counts to measure, comma separated")
    List<Integer> concurrencies;

    @Option(names = "--skip-sequential", description = "Do not measure the one-at-a-time baseline")
    boolean skipSequential;

    @Option(names = "--upload-only", description = "Do not measure downloads")
    boolean uploadOnly;

    @Option(names = "--report", paramLabel = "FILE", description = "JSON report path")
    Path reportPath;

    private final BenchmarkService benchmarkService;
    private final CloudBulkProperties properties;

    public BenchmarkCommand(TransferServiceProvider transferServiceProvider,
                            BenchmarkService benchmarkService,
                            CloudBulkProperties properties) {
        super(transferServiceProvider);
        this.benchmarkService = benchmarkService;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        BenchmarkReport report = benchmarkService.benchmark(transferOptions.getDriver(), settings());
        PrintWriter out = out();
        out.printf("Driver '%s' (%s): %d files x %d bytes%n", report.getDriver(), report.getDriverType(),
                report.getFileCount(), report.getFileSizeBytes());
        out.printf("%-14s %-9s %6s %9s %10s %9s %8s%n",
                "run", "direction", "items", "failed", "ms", "MB/s", "speedup");
        for (BenchmarkReport.Run run : report.getRuns()) {
            out.printf("%-14s %-9s %6d %9d %10d %9.2f %8s%n",
                    run.getLabel(), run.getDirection().name().toLowerCase(),
                    run.getSucceeded() + run.getFailed(), run.getFailed(), run.getDurationMs(),
                    run.getThroughputMbPerSecond(),
                    run.getSpeedup() == null ? "-" : String.format("%.2fx", run.getSpeedup()));
        }
        Path target = reportTarget();
        if (target != null) {
            benchmarkService.writeReport(report, target);
            out.println("Report: " + target);
        }
        out.flush();
        boolean failures = report.getRuns().stream().anyMatch(run -> run.getFailed() > 0);
        return failures ? ExitCode.SOFTWARE : ExitCode.OK;
    }

    private BenchmarkSettings settings() {
        CloudBulkProperties.Benchmark defaults = properties.getBenchmark();
        return BenchmarkSettings.builder()
                .bucket(bucket)
                .fileCount(fileCount != null ? fileCount : defaults.getFileCount())
                .fileSizeBytes((fileSizeKb != null ? fileSizeKb : defaults.getFileSizeKb()) * 1024)
                .concurrencies(concurrencies != null ? concurrencies : defaults.getConcurrencies())
                .includeSequential(!skipSequential)
                .includeDownload(!uploadOnly)
                .build();
    }

    private Path reportTarget() {
        if (reportPath != null) {
            return reportPath;
        }
        String configured = properties.getBenchmark().getReportPath();
        return configured == null || configured.isBlank() ? null : Path.of(configured);
    }
}
