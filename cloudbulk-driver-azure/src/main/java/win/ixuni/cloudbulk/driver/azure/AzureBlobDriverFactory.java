package win.ixuni.cloudbulk.driver.azure;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactory;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

/**
 * Azure Blob Storage driver factory
 */
@Slf4j
public class AzureBlobDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "azure-blob";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.info("Creating Azure Blob driver instance: {}", config.getName());
        return new AzureBlobStorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "Azure Blob Storage driver (storage accounts and Azurite)";
    }
}
