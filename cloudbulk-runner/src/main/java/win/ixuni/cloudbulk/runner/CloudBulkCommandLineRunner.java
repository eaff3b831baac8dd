package win.ixuni.cloudbulk.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import win.ixuni.cloudbulk.core.exception.BulkTransferException;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.runner.command.CloudBulkCommand;

/**
 * Runs the picocli command tree with the application arguments
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CloudBulkCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final IFactory factory;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    /**
     * Execute one command line
     *
     * @return 0 on success, 1 on failure, 2 on usage errors
     */
    public int execute(String... args) {
        return createCommandLine().execute(args);
    }

    public CommandLine createCommandLine() {
        return new CommandLine(CloudBulkCommand.class, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    if (e instanceof BulkTransferException bulkTransferException) {
                        cmd.getErr().println("Error [" + bulkTransferException.getErrorCode() + "]: " + e.getMessage());
                        bulkTransferException.getResult().failures().forEach(item -> cmd.getErr().println(
                                "  " + item.getPath() + ": " + item.getError().getMessage()));
                    } else if (e instanceof CloudBulkException cloudBulkException) {
                        cmd.getErr().println("Error [" + cloudBulkException.getErrorCode() + "]: " + e.getMessage());
                    } else {
                        cmd.getErr().println("Error: " + e.getMessage());
                    }
                    log.debug("Command '{}' failed", cmd.getCommandName(), e);
                    return CommandLine.ExitCode.SOFTWARE;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
