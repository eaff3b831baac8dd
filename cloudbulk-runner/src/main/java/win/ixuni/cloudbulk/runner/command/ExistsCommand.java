package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

/**
 * Prints {@code true} or {@code false}; a missing bucket is an error
 */
@Component
@Scope("prototype")
@Command(name = "exists", description = "Check whether an object exists")
public class ExistsCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    @Parameters(index = "1", paramLabel = "KEY")
    String key;

    public ExistsCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        Boolean exists = service().objectExists(bucket, key).block();
        out().println(Boolean.TRUE.equals(exists));
        out().flush();
        return ExitCode.OK;
    }
}
