package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import win.ixuni.cloudbulk.core.model.TransferDirection;
import win.ixuni.cloudbulk.runner.config.CloudBulkProperties;
import win.ixuni.cloudbulk.runner.registry.DriverRegistry;
import win.ixuni.cloudbulk.runner.service.BenchmarkReport;
import win.ixuni.cloudbulk.runner.service.BenchmarkService;
import win.ixuni.cloudbulk.runner.service.BenchmarkSettings;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one workload on several drivers and prints them side by side
 */
@Component
@Scope("prototype")
@Command(name = "compare", description = "Compare bulk transfer throughput across drivers")
public class CompareCommand extends AbstractDriverCommand {

    @Option(names = "--drivers", split = ",", paramLabel = "NAME",
            description = "Drivers to compare (default: all configured)")
    List<String> drivers;

    @Option(names = {"-b", "--bucket"}, paramLabel = "BUCKET", defaultValue = "cloudbulk-compare",
            description = "Bucket to use on every driver (default: ${DEFAULT-VALUE})")
    String bucket;

    @Option(names = "--files", paramLabel = "N", description = "Number of generated files")
    Integer fileCount;

    @Option(names = "--size-kb", paramLabel = "KB", description = "Size of each generated file")
    Integer fileSizeKb;

    @Option(names = "--report", paramLabel = "FILE", description = "JSON report path")
    Path reportPath;

    private final BenchmarkService benchmarkService;
    private final DriverRegistry driverRegistry;
    private final CloudBulkProperties properties;

    public CompareCommand(TransferServiceProvider transferServiceProvider,
                          BenchmarkService benchmarkService,
                          DriverRegistry driverRegistry,
                          CloudBulkProperties properties) {
        super(transferServiceProvider);
        this.benchmarkService = benchmarkService;
        this.driverRegistry = driverRegistry;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        List<String> names = drivers != null && !drivers.isEmpty()
                ? drivers
                : driverRegistry.getDriverNames();
        int concurrency = transferOptions.apply(transferServiceProvider.defaultOptions()).getConcurrency();
        CloudBulkProperties.Benchmark defaults = properties.getBenchmark();
        BenchmarkSettings settings = BenchmarkSettings.builder()
                .bucket(bucket)
                .fileCount(fileCount != null ? fileCount : defaults.getFileCount())
                .fileSizeBytes((fileSizeKb != null ? fileSizeKb : defaults.getFileSizeKb()) * 1024)
                .concurrency(concurrency)
                .includeSequential(false)
                .build();

        List<BenchmarkReport> reports = benchmarkService.compare(names, settings);

        PrintWriter out = out();
        out.printf("%d files x %d bytes, concurrency %d%n", settings.getFileCount(),
                settings.getFileSizeBytes(), concurrency);
        out.printf("%-16s %-12s %12s %12s %12s %12s%n",
                "driver", "type", "upload ms", "upload MB/s", "download ms", "download MB/s");
        boolean failures = false;
        for (BenchmarkReport report : reports) {
            BenchmarkReport.Run upload = find(report, TransferDirection.UPLOAD);
            BenchmarkReport.Run download = find(report, TransferDirection.DOWNLOAD);
            out.printf("%-16s %-12s %12d %12.2f %12d %12.2f%n",
                    report.getDriver(), report.getDriverType(),
                    upload.getDurationMs(), upload.getThroughputMbPerSecond(),
                    download.getDurationMs(), download.getThroughputMbPerSecond());
            failures |= upload.getFailed() > 0 || download.getFailed() > 0;
        }
        if (reportPath != null) {
            benchmarkService.writeReport(reports, reportPath);
            out.println("Report: " + reportPath);
        }
        out.flush();
        return failures ? ExitCode.SOFTWARE : ExitCode.OK;
    }

    private static BenchmarkReport.Run find(BenchmarkReport report, TransferDirection direction) {
        return report.getRuns().stream()
                .filter(run -> run.getDirection() == direction)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No " + direction + " run recorded for driver " + report.getDriver()));
    }
}
