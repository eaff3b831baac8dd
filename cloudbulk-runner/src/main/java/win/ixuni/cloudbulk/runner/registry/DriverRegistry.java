package win.ixuni.cloudbulk.runner.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactory;
import win.ixuni.cloudbulk.core.driver.DriverFactoryLoader;
import win.ixuni.cloudbulk.core.driver.StorageDriver;
import win.ixuni.cloudbulk.core.exception.DriverNotFoundException;
import win.ixuni.cloudbulk.runner.config.CloudBulkProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Driver registry
 * <p>
 * Holds one initialized driver per enabled {@code cloudbulk.drivers} entry. Several entries
 * may share a type (two S3 endpoints, say) under different names. An entry that fails to
 * start is logged and left out so the other drivers stay usable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverRegistry {

    private final CloudBulkProperties properties;

    /**
     * name -> driver, in configuration order; read-only after startup
     */
    private Map<String, StorageDriver> drivers = Map.of();

    @PostConstruct
    public void initialize() {
        List<DriverFactory> factories = DriverFactoryLoader.load();
        log.info("Driver types on classpath: {}", factories.stream().map(DriverFactory::getDriverType).toList());

        Map<String, StorageDriver> created = new LinkedHashMap<>();
        for (DriverConfig config : properties.getDrivers()) {
            if (!config.isEnabled()) {
                log.debug("Driver '{}' is disabled", config.getName());
                continue;
            }
            if (created.containsKey(config.getName())) {
                log.error("Duplicate driver name '{}', keeping the first entry", config.getName());
                continue;
            }
            try {
                created.put(config.getName(), DriverFactoryLoader.createDriver(config));
                log.info("Driver '{}' ready (type: {})", config.getName(), config.getType());
            } catch (RuntimeException e) {
                log.error("Driver '{}' (type: {}) could not be started: {}",
                        config.getName(), config.getType(), e.getMessage(), e);
            }
        }
        drivers = Collections.unmodifiableMap(created);
        log.info("{} of {} configured drivers available", drivers.size(), properties.getDrivers().size());
    }

    @PreDestroy
    public void shutdown() {
        Flux.fromIterable(drivers.values())
                .flatMap(driver -> driver.shutdown()
                        .onErrorResume(e -> {
                            log.warn("Driver '{}' did not shut down cleanly: {}", driver.getDriverName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        log.info("Drivers shut down");
    }

    /**
     * Resolve a driver by name
     *
     * @param name driver name, null or blank for the default driver
     * @throws DriverNotFoundException when no driver of that name is available
     */
    public StorageDriver getDriver(String name) {
        String resolved = name == null || name.isBlank() ? defaultDriverName() : name;
        StorageDriver driver = drivers.get(resolved);
        if (driver == null) {
            throw new DriverNotFoundException(resolved);
        }
        return driver;
    }

    /**
     * Names of the available drivers, in configuration order
     */
    public List<String> getDriverNames() {
        return List.copyOf(drivers.keySet());
    }

    private String defaultDriverName() {
        String configured = properties.getDefaultDriver();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return drivers.keySet().stream().findFirst().orElse("<none>");
    }
}
