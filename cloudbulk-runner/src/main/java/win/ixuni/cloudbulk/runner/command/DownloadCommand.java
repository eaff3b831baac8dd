package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.util.List;

@Component
@Scope("prototype")
@Command(name = "download", description = "Download explicit object keys to local files")
public class DownloadCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "LOCAL=KEY")
    List<String> pairs;

    public DownloadCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        BulkTransferResult result = service().download(bucket, parsePairs(pairs)).block();
        printResult(result);
        return result.isSuccessful() ? ExitCode.OK : ExitCode.SOFTWARE;
    }
}
