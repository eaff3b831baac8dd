package win.ixuni.cloudbulk.runner.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Workload of a benchmark or comparison run
 */
@Value
@Builder
public class BenchmarkSettings {

    String bucket;

    int fileCount;

    int fileSizeBytes;

    @Singular
    List<Integer> concurrencies;

    /**
     * Also measure one-at-a-time transfers as the speedup baseline
     */
    @Builder.Default
    boolean includeSequential = true;

    @Builder.Default
    boolean includeDownload = true;
}
