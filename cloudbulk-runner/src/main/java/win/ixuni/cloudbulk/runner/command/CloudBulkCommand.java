package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Root command, prints usage when no subcommand is given
 */
@Component
@Scope("prototype")
@Command(name = "cloudbulk",
        mixinStandardHelpOptions = true,
        version = "cloudbulk 1.0.0",
        description = "Bulk transfers between the local filesystem and object storage",
        subcommands = {
                UploadCommand.class,
                DownloadCommand.class,
                UploadDirCommand.class,
                DownloadDirCommand.class,
                ListCommand.class,
                ExistsCommand.class,
                CreateBucketCommand.class,
                EmptyBucketCommand.class,
                DeleteBucketCommand.class,
                DemoCommand.class,
                BenchmarkCommand.class,
                CompareCommand.class
        })
public class CloudBulkCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCode.USAGE;
    }
}
