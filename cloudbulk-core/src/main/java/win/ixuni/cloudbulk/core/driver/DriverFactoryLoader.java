package win.ixuni.cloudbulk.core.driver;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.exception.DriverNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link DriverFactory} implementations through {@code META-INF/services}
 * <p>
 * Putting a driver module on the classpath is enough to make its type available:
 *
 * <pre>
 * StorageDriver driver = DriverFactoryLoader.createDriver(DriverConfig.of("primary", "s3", props));
 * </pre>
 */
@Slf4j
public final class DriverFactoryLoader {

    private DriverFactoryLoader() {
    }

    /**
     * Factories visible to the context class loader
     */
    public static List<DriverFactory> load() {
        List<DriverFactory> factories = ServiceLoader
                .load(DriverFactory.class, Thread.currentThread().getContextClassLoader())
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        if (factories.isEmpty()) {
            log.warn("No driver modules on the classpath");
        } else {
            log.debug("Driver factories: {}", factories.stream().map(DriverFactory::getDriverType).toList());
        }
        return factories;
    }

    public static Optional<DriverFactory> find(String driverType) {
        return load().stream()
                .filter(factory -> factory.getDriverType().equals(driverType))
                .findFirst();
    }

    /**
     * Create a driver for {@code config} and wait for its initialization
     *
     * @throws DriverNotFoundException when no module provides {@code config.getType()}
     */
    public static StorageDriver createDriver(DriverConfig config) {
        StorageDriver driver = find(config.getType())
                .orElseThrow(() -> new DriverNotFoundException(config.getType()))
                .createDriver(config);
        driver.initialize().block();
        log.debug("Driver '{}' of type {} initialized", config.getName(), config.getType());
        return driver;
    }
}
