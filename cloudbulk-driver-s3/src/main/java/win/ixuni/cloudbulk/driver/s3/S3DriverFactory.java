package win.ixuni.cloudbulk.driver.s3;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactory;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

/**
 * S3 driver factory
 * <p>
 * Creates drivers for AWS S3 and S3-compatible backends (MinIO, LocalStack, ...).
 */
@Slf4j
public class S3DriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "s3";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.info("Creating S3 driver instance: {}", config.getName());
        return new S3StorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "S3 driver for AWS S3, MinIO, LocalStack and other S3-compatible backends";
    }
}
