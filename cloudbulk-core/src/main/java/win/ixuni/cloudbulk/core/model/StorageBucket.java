package win.ixuni.cloudbulk.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket (S3, GCS) or container (Azure)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageBucket {

    private String name;

    private Instant creationDate;
}
