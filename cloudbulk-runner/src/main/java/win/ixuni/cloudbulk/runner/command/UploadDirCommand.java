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
@Command(name = "upload-dir", description = "Upload every file under a local directory")
public class UploadDirCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    @Parameters(index = "1", paramLabel = "LOCAL_DIR")
    Path localDir;

    @Parameters(index = "2", arity = "0..1", paramLabel = "STORAGE_DIR",
            description = "Key prefix, bucket root when omitted")
    String storageDir = "";

    public UploadDirCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        BulkTransferResult result = service().uploadDirectory(bucket, localDir, storageDir).block();
        printResult(result);
        return result.isSuccessful() ? ExitCode.OK : ExitCode.SOFTWARE;
    }
}
