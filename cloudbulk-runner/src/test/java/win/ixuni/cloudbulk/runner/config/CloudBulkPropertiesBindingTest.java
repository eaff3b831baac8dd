package win.ixuni.cloudbulk.runner.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mock.env.MockEnvironment;
import win.ixuni.cloudbulk.core.config.DriverConfig;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds the shipped application.yml against environment variables
 */
class CloudBulkPropertiesBindingTest {

    private static CloudBulkProperties bind(MockEnvironment environment) throws IOException {
        new YamlPropertySourceLoader()
                .load("application", new FileSystemResource("src/main/resources/application.yml"))
                .forEach(environment.getPropertySources()::addLast);
        return Binder.get(environment).bind("cloudbulk", CloudBulkProperties.class).get();
    }

    private static DriverConfig driver(CloudBulkProperties properties, String name) {
        return properties.getDrivers().stream()
                .filter(config -> name.equals(config.getName()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("GCS credentials come from GOOGLE_CLOUD_CREDENTIALS_PATH and GOOGLE_CLOUD_CREDENTIALS_JSON")
    void testGcsCredentialsFromEnvironment() throws IOException {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("GCS_ENABLED", "true")
                .withProperty("GOOGLE_CLOUD_CREDENTIALS_PATH", "/secrets/gcs.json")
                .withProperty("GOOGLE_CLOUD_CREDENTIALS_JSON", "{\"type\":\"service_account\"}");

        DriverConfig gcs = driver(bind(environment), "gcs");

        assertTrue(gcs.isEnabled());
        assertEquals("gcs", gcs.getType());
        assertEquals("/secrets/gcs.json", gcs.getString("credentials-path", null));
        assertEquals("{\"type\":\"service_account\"}", gcs.getString("credentials-json", null));
    }

    @Test
    @DisplayName("Unset variables leave cloud drivers disabled and credentials blank")
    void testDefaults() throws IOException {
        CloudBulkProperties properties = bind(new MockEnvironment());

        assertEquals("memory", properties.getDefaultDriver());
        assertFalse(driver(properties, "gcs").isEnabled());
        assertTrue(driver(properties, "gcs").getString("credentials-json", "").isBlank());
        assertFalse(driver(properties, "s3").isEnabled());
        assertEquals(300, driver(properties, "s3").getInt("max-connections", 0));
        assertTrue(properties.getCleanup().shouldDeleteBuckets());
    }
}
