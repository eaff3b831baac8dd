package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

@Component
@Scope("prototype")
@Command(name = "delete-bucket", description = "Delete a bucket")
public class DeleteBucketCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    @Option(names = {"-f", "--force"}, description = "Empty the bucket first")
    boolean force;

    public DeleteBucketCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        service().deleteBucket(bucket, force).block();
        out().println("Deleted bucket '" + bucket + "'");
        out().flush();
        return ExitCode.OK;
    }
}
