package win.ixuni.cloudbulk.driver.gcs.context;

import com.google.cloud.storage.Storage;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudbulk.driver.gcs.GcsDriverFactory;

/**
 * GCS driver context
 */
@Getter
@Builder
public class GcsDriverContext implements DriverContext {

    private final DriverConfig config;

    /**
     * Blocking storage client
     */
    private final Storage storage;

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return GcsDriverFactory.DRIVER_TYPE;
    }
}
