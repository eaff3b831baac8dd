package win.ixuni.cloudbulk.core.driver;

import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.transfer.StubStorageDriver;

/**
 * Registered through META-INF/services for loader tests
 */
public class TestDriverFactory implements DriverFactory {

    @Override
    public String getDriverType() {
        return "stub";
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        return new StubStorageDriver();
    }
}
