package win.ixuni.cloudbulk.driver.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.AbstractStorageDriver;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.driver.memory.context.MemoryDriverContext;
import win.ixuni.cloudbulk.driver.memory.handler.bucket.MemoryBucketExistsHandler;
import win.ixuni.cloudbulk.driver.memory.handler.bucket.MemoryCreateBucketHandler;
import win.ixuni.cloudbulk.driver.memory.handler.bucket.MemoryDeleteBucketHandler;
import win.ixuni.cloudbulk.driver.memory.handler.object.MemoryDeleteObjectsHandler;
import win.ixuni.cloudbulk.driver.memory.handler.object.MemoryDownloadFileHandler;
import win.ixuni.cloudbulk.driver.memory.handler.object.MemoryListObjectsHandler;
import win.ixuni.cloudbulk.driver.memory.handler.object.MemoryObjectExistsHandler;
import win.ixuni.cloudbulk.driver.memory.handler.object.MemoryUploadFileHandler;

import java.time.Duration;

/**
 * Memory storage driver
 * <p>
 * Keeps buckets and objects in memory with the same semantics as the cloud drivers.
 * The optional {@code simulated-latency-ms} property delays every operation, which makes
 * concurrency effects visible in dry-run benchmarks.
 */
@Slf4j
public class MemoryStorageDriver extends AbstractStorageDriver {

    @Getter
    private final DriverConfig config;

    private final MemoryDriverContext driverContext;

    public MemoryStorageDriver(DriverConfig config) {
        this.config = config;
        this.driverContext = MemoryDriverContext.builder()
                .config(config)
                .simulatedLatency(Duration.ofMillis(config.getLong("simulated-latency-ms", 0L)))
                .build();
        registerHandlers();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new MemoryCreateBucketHandler());
        getHandlerRegistry().register(new MemoryDeleteBucketHandler());
        getHandlerRegistry().register(new MemoryBucketExistsHandler());

        getHandlerRegistry().register(new MemoryUploadFileHandler());
        getHandlerRegistry().register(new MemoryDownloadFileHandler());
        getHandlerRegistry().register(new MemoryObjectExistsHandler());
        getHandlerRegistry().register(new MemoryListObjectsHandler());
        getHandlerRegistry().register(new MemoryDeleteObjectsHandler());

        log.info("Registered {} operation handlers for memory driver", getHandlerRegistry().size());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing memory storage driver: {}", config.getName());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down memory storage driver: {}", config.getName());
        driverContext.getBuckets().clear();
        return Mono.empty();
    }
}
