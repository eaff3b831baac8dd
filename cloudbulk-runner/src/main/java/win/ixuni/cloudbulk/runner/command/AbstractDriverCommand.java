package win.ixuni.cloudbulk.runner.command;

import picocli.CommandLine;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import win.ixuni.cloudbulk.core.model.BulkTransferResult;
import win.ixuni.cloudbulk.core.model.StorageTransferPath;
import win.ixuni.cloudbulk.core.transfer.BulkTransferService;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Base class for commands that run against one configured driver
 */
public abstract class AbstractDriverCommand implements Callable<Integer> {

    @Spec
    protected CommandSpec spec;

    @Mixin
    protected TransferOptionsMixin transferOptions;

    protected final TransferServiceProvider transferServiceProvider;

    protected AbstractDriverCommand(TransferServiceProvider transferServiceProvider) {
        this.transferServiceProvider = transferServiceProvider;
    }

    protected BulkTransferService service() {
        return transferServiceProvider.forDriver(transferOptions.getDriver(),
                transferOptions.apply(transferServiceProvider.defaultOptions()));
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    /**
     * Parse {@code LOCAL=KEY} arguments, splitting at the first '='
     */
    protected List<StorageTransferPath> parsePairs(List<String> pairs) {
        List<StorageTransferPath> paths = new ArrayList<>(pairs.size());
        for (String pair : pairs) {
            int separator = pair.indexOf('=');
            if (separator <= 0 || separator == pair.length() - 1) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Invalid transfer pair '" + pair + "', expected LOCAL=KEY");
            }
            paths.add(StorageTransferPath.of(pair.substring(0, separator), pair.substring(separator + 1)));
        }
        return paths;
    }

    protected void printResult(BulkTransferResult result) {
        printResult(out(), result);
    }

    static void printResult(PrintWriter out, BulkTransferResult result) {
        out.printf("%s: %d/%d items, %d bytes in %d ms (%.2f MB/s)%n",
                capitalize(result.getDirection().name()),
                result.getSucceededCount(), result.getItems().size(), result.getTotalBytes(),
                result.getDuration().toMillis(), result.getThroughputMbPerSecond());
        result.failures().forEach(item -> out.printf("  FAILED %s: %s%n", item.getPath(),
                item.getError() != null ? item.getError().getMessage() : "unknown error"));
        out.flush();
    }

    private static String capitalize(String value) {
        String lower = value.toLowerCase();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
