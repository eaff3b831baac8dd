package win.ixuni.cloudbulk.runner.command;

import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.util.StoragePaths;
import win.ixuni.cloudbulk.runner.service.TransferServiceProvider;

import java.io.PrintWriter;
import java.util.List;

@Component
@Scope("prototype")
@Command(name = "list", description = "List object keys under a storage directory")
public class ListCommand extends AbstractDriverCommand {

    @Parameters(index = "0", paramLabel = "BUCKET")
    String bucket;

    @Parameters(index = "1", arity = "0..1", paramLabel = "STORAGE_DIR")
    String storageDir = "";

    @Option(names = {"-l", "--long"}, description = "Also print size and last modified time")
    boolean longFormat;

    public ListCommand(TransferServiceProvider transferServiceProvider) {
        super(transferServiceProvider);
    }

    @Override
    public Integer call() {
        PrintWriter out = out();
        if (longFormat) {
            List<StorageObject> objects = service()
                    .streamObjects(bucket, StoragePaths.directoryPrefix(storageDir))
                    .collectList()
                    .block();
            objects.forEach(object -> out.printf("%12d  %-25s  %s%n",
                    object.getSize(), object.getLastModified(), object.getKey()));
            out.printf("%d objects%n", objects.size());
        } else {
            List<String> keys = service().listObjects(bucket, storageDir).block();
            keys.forEach(out::println);
            out.printf("%d objects%n", keys.size());
        }
        out.flush();
        return ExitCode.OK;
    }
}
