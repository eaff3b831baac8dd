package win.ixuni.cloudbulk.driver.gcs;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.NoCredentials;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.AbstractStorageDriver;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.driver.gcs.context.GcsDriverContext;
import win.ixuni.cloudbulk.driver.gcs.handler.bucket.GcsBucketExistsHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.bucket.GcsCreateBucketHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.bucket.GcsDeleteBucketHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.object.GcsDeleteObjectsHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.object.GcsDownloadFileHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.object.GcsListObjectsHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.object.GcsObjectExistsHandler;
import win.ixuni.cloudbulk.driver.gcs.handler.object.GcsUploadFileHandler;
import win.ixuni.cloudbulk.driver.gcs.interceptor.GcsExceptionTranslationInterceptor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Google Cloud Storage driver
 * <p>
 * The {@link Storage} client is blocking; handlers run it on the bounded-elastic scheduler.
 * Configuration properties:
 * <ul>
 *     <li>{@code project-id}: GCP project, taken from the environment when absent</li>
 *     <li>{@code credentials-path}: service account key file</li>
 *     <li>{@code credentials-json}: inline service account key, wins over {@code credentials-path}</li>
 *     <li>{@code host}: emulator endpoint (fake-gcs-server), implies no credentials</li>
 * </ul>
 * Without explicit credentials Application Default Credentials are used.
 */
@Slf4j
public class GcsStorageDriver extends AbstractStorageDriver {

    @Getter
    private final DriverConfig config;

    private final GcsDriverContext driverContext;

    public GcsStorageDriver(DriverConfig config) {
        this(config, buildStorage(config));
    }

    /**
     * Create a driver around an existing client
     */
    public GcsStorageDriver(DriverConfig config, Storage storage) {
        this.config = config;
        this.driverContext = GcsDriverContext.builder()
                .config(config)
                .storage(storage)
                .build();

        registerHandlers();
        registerInterceptors();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private static Storage buildStorage(DriverConfig config) {
        StorageOptions.Builder builder = StorageOptions.newBuilder();

        String projectId = config.getString("project-id", null);
        if (projectId != null && !projectId.isBlank()) {
            builder.setProjectId(projectId);
        }

        String host = config.getString("host", null);
        String credentialsJson = config.getString("credentials-json", null);
        String credentialsPath = config.getString("credentials-path", null);

        if (host != null && !host.isBlank()) {
            builder.setHost(host).setCredentials(NoCredentials.getInstance());
        } else if (credentialsJson != null && !credentialsJson.isBlank()) {
            builder.setCredentials(loadCredentials(config,
                    new ByteArrayInputStream(credentialsJson.getBytes(StandardCharsets.UTF_8)), "credentials-json"));
        } else if (credentialsPath != null && !credentialsPath.isBlank()) {
            try (InputStream in = Files.newInputStream(Path.of(credentialsPath))) {
                builder.setCredentials(loadCredentials(config, in, credentialsPath));
            } catch (IOException e) {
                throw new IllegalArgumentException(
                        "GCS driver '" + config.getName() + "': cannot read credentials file " + credentialsPath, e);
            }
        } else {
            log.debug("GCS driver '{}': no explicit credentials, using Application Default Credentials",
                    config.getName());
        }

        return builder.build().getService();
    }

    private static GoogleCredentials loadCredentials(DriverConfig config, InputStream in, String source) {
        try {
            return GoogleCredentials.fromStream(in);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "GCS driver '" + config.getName() + "': invalid credentials in " + source, e);
        }
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new GcsCreateBucketHandler());
        getHandlerRegistry().register(new GcsDeleteBucketHandler());
        getHandlerRegistry().register(new GcsBucketExistsHandler());

        getHandlerRegistry().register(new GcsUploadFileHandler());
        getHandlerRegistry().register(new GcsDownloadFileHandler());
        getHandlerRegistry().register(new GcsObjectExistsHandler());
        getHandlerRegistry().register(new GcsListObjectsHandler());
        getHandlerRegistry().register(new GcsDeleteObjectsHandler());

        log.info("Registered {} operation handlers for GCS driver", getHandlerRegistry().size());
    }

    private void registerInterceptors() {
        getHandlerRegistry().addInterceptor(new GcsExceptionTranslationInterceptor());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return GcsDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing GCS driver: {} (project {})",
                config.getName(), config.getString("project-id", "default"));
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down GCS driver: {}", config.getName());
        return Mono.fromCallable(() -> {
                    driverContext.getStorage().close();
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
