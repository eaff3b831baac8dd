package win.ixuni.cloudbulk.runner.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import win.ixuni.cloudbulk.core.driver.StorageDriver;
import win.ixuni.cloudbulk.core.transfer.BulkTransferService;
import win.ixuni.cloudbulk.core.transfer.TransferOptions;
import win.ixuni.cloudbulk.runner.config.CloudBulkProperties;
import win.ixuni.cloudbulk.runner.registry.DriverRegistry;

/**
 * Builds {@link BulkTransferService} instances over registered drivers
 */
@Service
@RequiredArgsConstructor
public class TransferServiceProvider {

    private final DriverRegistry driverRegistry;
    private final CloudBulkProperties properties;

    /**
     * Default transfer options from configuration
     */
    public TransferOptions defaultOptions() {
        return properties.getTransfer().toOptions();
    }

    public BulkTransferService forDriver(String driverName, TransferOptions options) {
        StorageDriver driver = driverRegistry.getDriver(driverName);
        return new BulkTransferService(driver, options);
    }

    public BulkTransferService forDriver(String driverName) {
        return forDriver(driverName, defaultOptions());
    }
}
