package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.nio.file.Path;

@Component
@Scope("prototype")
@Command(name = "download-dir", description = "Download every object under a key prefix, keeping relative paths")
public class DownloadDirCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    @Parameters(index = "1", paramLabel = "STORAGE_DIR")
    String storageDir;

    @Parameters(index = "2", paramLabel = "LOCAL_DIR")
    Path localDir;

    public DownloadDirCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        BulkTransferResult result = service().downloadDirectory(bucket, storageDir, localDir).block();
        printResult(result);
        return result.isSuccessful() ? ExitCode.OK : ExitCode.SOFTWARE;
    }
}
