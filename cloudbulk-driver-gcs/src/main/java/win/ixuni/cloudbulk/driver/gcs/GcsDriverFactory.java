package win.ixuni.cloudbulk.driver.gcs;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactory;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

/**
 * Google Cloud Storage driver factory
 */
@Slf4j
public class GcsDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "gcs";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.info("Creating GCS driver instance: {}", config.getName());
        return new GcsStorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "Google Cloud Storage driver";
    }
}
