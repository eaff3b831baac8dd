package win.ixuni.cloudbulk.driver.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactory;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

/**
 * In-memory driver factory
 */
@Slf4j
public class MemoryDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "memory";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.info("Creating memory driver instance: {}", config.getName());
        return new MemoryStorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "In-memory storage driver for tests and dry runs";
    }
}
