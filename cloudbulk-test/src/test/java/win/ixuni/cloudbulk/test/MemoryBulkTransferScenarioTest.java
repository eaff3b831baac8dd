package win.ixuni.cloudbulk.test;

import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactoryLoader;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

class MemoryBulkTransferScenarioTest extends AbstractBulkTransferScenarioTest {

    @Override
    protected StorageDriver createDriver() {
        return DriverFactoryLoader.createDriver(DriverConfig.of("memory", "memory", null));
    }
}
