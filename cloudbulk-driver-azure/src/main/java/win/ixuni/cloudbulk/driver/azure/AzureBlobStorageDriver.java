package win.ixuni.cloudbulk.driver.azure;

import com.azure.storage.blob.BlobServiceAsyncClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.AbstractStorageDriver;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.driver.azure.context.AzureBlobDriverContext;
import win.ixuni.cloudbulk.driver.azure.handler.bucket.AzureBucketExistsHandler;
import win.ixuni.cloudbulk.driver.azure.handler.bucket.AzureCreateBucketHandler;
import win.ixuni.cloudbulk.driver.azure.handler.bucket.AzureDeleteBucketHandler;
import win.ixuni.cloudbulk.driver.azure.handler.object.AzureDeleteObjectsHandler;
import win.ixuni.cloudbulk.driver.azure.handler.object.AzureDownloadFileHandler;
import win.ixuni.cloudbulk.driver.azure.handler.object.AzureListObjectsHandler;
import win.ixuni.cloudbulk.driver.azure.handler.object.AzureObjectExistsHandler;
import win.ixuni.cloudbulk.driver.azure.handler.object.AzureUploadFileHandler;
import win.ixuni.cloudbulk.driver.azure.interceptor.AzureExceptionTranslationInterceptor;

/**
 * Azure Blob Storage driver
 * <p>
 * Buckets map to containers. Configuration properties:
 * <ul>
 *     <li>{@code connection-string}: storage account connection string (required)</li>
 *     <li>{@code max-concurrency}: parallel block transfers per blob, default {@value #DEFAULT_MAX_CONCURRENCY}</li>
 * </ul>
 */
@Slf4j
public class AzureBlobStorageDriver extends AbstractStorageDriver {

    public static final int DEFAULT_MAX_CONCURRENCY = 4;

    @Getter
    private final DriverConfig config;

    private final AzureBlobDriverContext driverContext;

    public AzureBlobStorageDriver(DriverConfig config) {
        this.config = config;

        int maxConcurrency = config.getInt("max-concurrency", DEFAULT_MAX_CONCURRENCY);
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException(
                    "Azure driver '" + config.getName() + "': max-concurrency must be positive");
        }

        BlobServiceAsyncClient serviceClient = new BlobServiceClientBuilder()
                .connectionString(config.getRequiredString("connection-string"))
                .buildAsyncClient();

        this.driverContext = AzureBlobDriverContext.builder()
                .config(config)
                .serviceClient(serviceClient)
                .maxConcurrency(maxConcurrency)
                .build();

        registerHandlers();
        registerInterceptors();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new AzureCreateBucketHandler());
        getHandlerRegistry().register(new AzureDeleteBucketHandler());
        getHandlerRegistry().register(new AzureBucketExistsHandler());

        getHandlerRegistry().register(new AzureUploadFileHandler());
        getHandlerRegistry().register(new AzureDownloadFileHandler());
        getHandlerRegistry().register(new AzureObjectExistsHandler());
        getHandlerRegistry().register(new AzureListObjectsHandler());
        getHandlerRegistry().register(new AzureDeleteObjectsHandler());

        log.info("Registered {} operation handlers for Azure Blob driver", getHandlerRegistry().size());
    }

    private void registerInterceptors() {
        getHandlerRegistry().addInterceptor(new AzureExceptionTranslationInterceptor());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return AzureBlobDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing Azure Blob driver: {} -> {}",
                config.getName(), driverContext.getServiceClient().getAccountName());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        // BlobServiceAsyncClient is not closeable
        log.info("Shutting down Azure Blob driver: {}", config.getName());
        return Mono.empty();
    }
}
