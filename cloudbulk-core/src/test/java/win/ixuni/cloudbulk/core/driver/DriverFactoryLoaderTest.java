package win.ixuni.cloudbulk.core.driver;

import org.junit.jupiter.api.Test;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.exception.DriverNotFoundException;

import static org.junit.jupiter.api.Assertions.*;

class DriverFactoryLoaderTest {

    @Test
    void testLoadDiscoversServiceRegistrations() {
        assertTrue(DriverFactoryLoader.load().stream()
                .anyMatch(factory -> factory instanceof TestDriverFactory));
        assertTrue(DriverFactoryLoader.find("stub").isPresent());
        assertTrue(DriverFactoryLoader.find("unknown").isEmpty());
    }

    @Test
    void testCreateDriver() {
        StorageDriver driver = DriverFactoryLoader.createDriver(DriverConfig.of("local-stub", "stub", null));

        assertEquals("stub", driver.getDriverType());
        assertTrue(driver.supportsAll(Capability.READ, Capability.WRITE, Capability.BATCH_DELETE));
    }

    @Test
    void testCreateDriver_UnknownType() {
        DriverNotFoundException error = assertThrows(DriverNotFoundException.class,
                () -> DriverFactoryLoader.createDriver(DriverConfig.of("x", "ftp", null)));
        assertTrue(error.getMessage().contains("ftp"));
    }
}
