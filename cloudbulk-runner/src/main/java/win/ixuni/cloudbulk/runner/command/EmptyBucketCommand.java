package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

@Component
@Scope("prototype")
@Command(name = "empty-bucket", description = "Delete every object in a bucket")
public class EmptyBucketCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    public EmptyBucketCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        Integer deleted = service().emptyBucket(bucket).block();
        out().printf("Deleted %d objects from '%s'%n", deleted, bucket);
        out().flush();
        return ExitCode.OK;
    }
}
