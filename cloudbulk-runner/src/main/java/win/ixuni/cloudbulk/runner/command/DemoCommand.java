package win.ixuni.cloudbulk.runner.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.core.model.StorageTransferPath;
import win.ixuni.cloudbulk.core.transfer.BulkTransferService;
import win.ixuni.cloudbulk.runner.service.CleanupService;
import win.ixuni.cloudbulk.runner.service.LocalTestData;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Walks through every bulk operation against one driver
 */
@Slf4j
@Component
@Scope("prototype")
@Command(name = "demo", description = "Run the end-to-end walkthrough against one driver")
public class DemoCommand extends AbstractDriverCommand {

    private static final String TREE_PREFIX = "demo/tree";
    private static final String PAIRS_PREFIX = "demo/pairs";

    @Option(names = {"-b", "--bucket"}, paramLabel = "BUCKET", defaultValue = "cloudbulk-demo",
            description = "Bucket to use (default: ${DEFAULT-VALUE})")
    String bucket;

    private final CleanupService cleanupService;

    public DemoCommand(TransferServiceProvider transferServiceProvider, CleanupService cleanupService) {
        super(transferServiceProvider);
        this.cleanupService = cleanupService;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = out();
        BulkTransferService service = service();
        Path workDir = Files.createTempDirectory("cloudbulk-demo-");
        boolean ok = true;
        try {
            out.printf("== Driver '%s' (%s), concurrency %d%n", service.getDriver().getDriverName(),
                    service.getDriver().getDriverType(), service.getOptions().getConcurrency());

            boolean created = Boolean.TRUE.equals(service.createBucket(bucket).block());
            out.printf("1. Bucket '%s' %s%n", bucket, created ? "created" : "already exists");

            Path tree = workDir.resolve("upload");
            List<Path> files = LocalTestData.createDemoTree(tree);
            out.printf("2. Generated %d local files under %s%n", files.size(), tree);

            out.print("3. Upload directory. ");
            BulkTransferResult uploaded = service.uploadDirectory(bucket, tree, TREE_PREFIX).block();
            printResult(out, uploaded);
            ok &= uploaded.isSuccessful();

            out.print("4. Download directory. ");
            BulkTransferResult downloaded = service.downloadDirectory(bucket, TREE_PREFIX,
                    workDir.resolve("download")).block();
            printResult(out, downloaded);
            ok &= downloaded.isSuccessful();

            List<StorageTransferPath> uploadPairs = List.of(
                    new StorageTransferPath(tree.resolve("readme.txt"), PAIRS_PREFIX + "/readme-copy.txt"),
                    new StorageTransferPath(tree.resolve("docs").resolve("doc_1.txt"), PAIRS_PREFIX + "/doc-copy.txt"));
            out.print("5. Upload explicit pairs. ");
            BulkTransferResult pairsUploaded = service.upload(bucket, uploadPairs).block();
            printResult(out, pairsUploaded);
            ok &= pairsUploaded.isSuccessful();

            Path pairsDir = workDir.resolve("pairs");
            List<StorageTransferPath> downloadPairs = uploadPairs.stream()
                    .map(path -> new StorageTransferPath(
                            pairsDir.resolve(path.getLocalPath().getFileName()), path.getStoragePath()))
                    .toList();
            out.print("6. Download explicit pairs. ");
            BulkTransferResult pairsDownloaded = service.download(bucket, downloadPairs).block();
            printResult(out, pairsDownloaded);
            ok &= pairsDownloaded.isSuccessful();

            String existing = TREE_PREFIX + "/readme.txt";
            String missing = TREE_PREFIX + "/does-not-exist.txt";
            out.printf("7. exists(%s) = %s, exists(%s) = %s%n",
                    existing, service.objectExists(bucket, existing).block(),
                    missing, service.objectExists(bucket, missing).block());

            List<String> keys = service.listObjects(bucket, "demo").block();
            out.printf("8. %d objects under 'demo':%n", keys.size());
            keys.forEach(key -> out.println("   " + key));
        } finally {
            out.println("9. Cleanup");
            out.flush();
            cleanupService.cleanupBucket(service, bucket);
            cleanupService.cleanupLocal(workDir);
        }
        out.println(ok ? "Demo completed" : "Demo completed with failures");
        out.flush();
        return ok ? ExitCode.OK : ExitCode.SOFTWARE;
    }
}
