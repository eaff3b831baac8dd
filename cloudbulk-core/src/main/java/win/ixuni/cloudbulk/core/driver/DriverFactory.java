package win.ixuni.cloudbulk.core.driver;

import win.ixuni.cloudbulk.core.config.DriverConfig;

/**
 * Driver factory interface
 * <p>
 * Each backend provides a factory implementation to create driver instances from configuration.
 * Several instances of the same type may coexist (e.g. two S3 endpoints).
 */
public interface DriverFactory {

    /**
     * Get the driver type supported by this factory
     *
     * @return driver type identifier (e.g. "s3", "azure-blob", "gcs")
     */
    String getDriverType();

    /**
     * Create a driver instance from configuration
     *
     * @param config driver configuration
     * @return driver instance
     */
    StorageDriver createDriver(DriverConfig config);

    /**
     * Get the driver description
     *
     * @return description text
     */
    default String getDescription() {
        return getDriverType() + " storage driver";
    }
}
