package win.ixuni.cloudbulk.runner.command;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import win.ixuni.cloudbulk.core.transfer.FailurePolicy;
import win.ixuni.cloudbulk.core.transfer.TransferOptions;

/**
 * Options shared by every command that talks to a driver
 */
public class TransferOptionsMixin {

    @Spec(Spec.Target.MIXEE)
    CommandSpec mixee;

    @Option(names = {"-d", "--driver"}, paramLabel = "NAME",
            description = "Configured driver name (default: cloudbulk.default-driver)")
    String driver;

    @Option(names = {"-c", "--concurrency"}, paramLabel = "N",
            description = "Maximum transfers in flight")
    Integer concurrency;

    @Option(names = "--failure-policy", paramLabel = "POLICY",
            description = "FAIL_AT_END, FAIL_FAST or COLLECT")
    FailurePolicy failurePolicy;

    @Option(names = {"-v", "--verbose"}, description = "Log every transferred item")
    boolean verbose;

    @Option(names = "--no-overwrite", description = "Fail downloads whose local file already exists")
    boolean noOverwrite;

    public String getDriver() {
        return driver;
    }

    /**
     * Overlay the given command line flags on configured defaults
     *
     * @throws CommandLine.ParameterException when {@code --concurrency} is below 1
     */
    public TransferOptions apply(TransferOptions defaults) {
        TransferOptions.TransferOptionsBuilder builder = defaults.toBuilder();
        if (concurrency != null) {
            if (concurrency < 1) {
                throw new CommandLine.ParameterException(mixee.commandLine(),
                        "Invalid value for option '--concurrency': " + concurrency + " (must be at least 1)");
            }
            builder.concurrency(concurrency);
        }
        if (failurePolicy != null) {
            builder.failurePolicy(failurePolicy);
        }
        if (verbose) {
            builder.verbose(true);
        }
        if (noOverwrite) {
            builder.overwrite(false);
        }
        return builder.build();
    }
}
