package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

@Component
@Scope("prototype")
@Command(name = "create-bucket", description = "Create a bucket, succeeding when it already exists")
public class CreateBucketCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    public CreateBucketCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        boolean created = Boolean.TRUE.equals(service().createBucket(bucket).block());
        out().println(created
                ? "Created bucket '" + bucket + "'"
                : "Bucket '" + bucket + "' already exists");
        out().flush();
        return ExitCode.OK;
    }
}
