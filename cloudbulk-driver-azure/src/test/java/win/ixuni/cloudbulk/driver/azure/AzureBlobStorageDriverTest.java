package win.ixuni.cloudbulk.driver.azure;

import org.junit.jupiter.api.Test;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.driver.DriverFactoryLoader;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AzureBlobStorageDriverTest {

    static final String AZURITE_CONNECTION_STRING = "DefaultEndpointsProtocol=http;AccountName=devstoreaccount1;"
            + "AccountKey=Eby8vdM02xNOcqFlqUwJPLlmEtlCDXJ1OUzFT50uSRZ6IFsuFq2UVErCz4I6tq/K1SZFPTOtr/KBHBeksoGMGw==;"
            + "BlobEndpoint=http://127.0.0.1:10000/devstoreaccount1;";

    @Test
    void testCreatedThroughServiceLoader() {
        StorageDriver driver = DriverFactoryLoader.createDriver(DriverConfig.of("azure-test", "azure-blob",
                Map.of("connection-string", AZURITE_CONNECTION_STRING)));

        assertInstanceOf(AzureBlobStorageDriver.class, driver);
        assertEquals("azure-blob", driver.getDriverType());
        assertTrue(driver.supportsAll(Capability.READ, Capability.WRITE,
                Capability.BATCH_DELETE, Capability.BUCKET_MANAGEMENT));
        driver.shutdown().block();
    }

    @Test
    void testConnectionStringRequired() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new AzureBlobStorageDriver(DriverConfig.of("azure-test", "azure-blob", Map.of())));
        assertTrue(error.getMessage().contains("connection-string"));
    }

    @Test
    void testInvalidConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> new AzureBlobStorageDriver(DriverConfig.of("azure-test", "azure-blob", Map.of(
                        "connection-string", AZURITE_CONNECTION_STRING,
                        "max-concurrency", 0))));
    }
}
