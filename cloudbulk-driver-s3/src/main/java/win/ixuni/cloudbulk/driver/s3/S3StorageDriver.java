package win.ixuni.cloudbulk.driver.s3;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.AbstractStorageDriver;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.driver.s3.context.S3DriverContext;
import win.ixuni.cloudbulk.driver.s3.handler.bucket.S3BucketExistsHandler;
import win.ixuni.cloudbulk.driver.s3.handler.bucket.S3CreateBucketHandler;
import win.ixuni.cloudbulk.driver.s3.handler.bucket.S3DeleteBucketHandler;
import win.ixuni.cloudbulk.driver.s3.handler.object.S3DeleteObjectsHandler;
import win.ixuni.cloudbulk.driver.s3.handler.object.S3DownloadFileHandler;
import win.ixuni.cloudbulk.driver.s3.handler.object.S3ListObjectsHandler;
import win.ixuni.cloudbulk.driver.s3.handler.object.S3ObjectExistsHandler;
import win.ixuni.cloudbulk.driver.s3.handler.object.S3UploadFileHandler;
import win.ixuni.cloudbulk.driver.s3.interceptor.S3ExceptionTranslationInterceptor;

import java.net.URI;

/**
 * S3 storage driver
 * <p>
 * Configuration properties:
 * <ul>
 *     <li>{@code endpoint}: endpoint override for MinIO / LocalStack, AWS when absent</li>
 *     <li>{@code access-key}, {@code secret-key}: static credentials, default provider chain when absent</li>
 *     <li>{@code region}: default {@value #DEFAULT_REGION}</li>
 *     <li>{@code path-style}: path-style addressing, default true</li>
 *     <li>{@code max-connections}: HTTP connection pool size, default {@value #DEFAULT_MAX_CONNECTIONS}</li>
 *     <li>{@code use-transfer-manager}: transfer files through {@link S3TransferManager}, default true</li>
 * </ul>
 */
@Slf4j
public class S3StorageDriver extends AbstractStorageDriver {

    public static final String DEFAULT_REGION = "us-east-1";
    public static final int DEFAULT_MAX_CONNECTIONS = 300;

    @Getter
    private final DriverConfig config;

    private final S3DriverContext driverContext;
    private final S3AsyncClient s3Client;
    private final S3TransferManager transferManager;

    public S3StorageDriver(DriverConfig config) {
        this.config = config;

        boolean useTransferManager = config.getBoolean("use-transfer-manager", true);
        this.s3Client = buildS3Client(config, useTransferManager);
        this.transferManager = useTransferManager
                ? S3TransferManager.builder().s3Client(s3Client).build()
                : null;

        this.driverContext = S3DriverContext.builder()
                .config(config)
                .s3Client(s3Client)
                .transferManager(transferManager)
                .build();

        registerHandlers();
        registerInterceptors();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private S3AsyncClient buildS3Client(DriverConfig config, boolean multipart) {
        String endpoint = config.getString("endpoint", null);
        String region = config.getString("region", DEFAULT_REGION);
        boolean pathStyle = config.getBoolean("path-style", true);
        int maxConnections = config.getInt("max-connections", DEFAULT_MAX_CONNECTIONS);

        if (maxConnections < 1) {
            throw new IllegalArgumentException(
                    "S3 driver '" + config.getName() + "': max-connections must be positive");
        }

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider(config))
                .forcePathStyle(pathStyle)
                .multipartEnabled(multipart)
                .httpClientBuilder(NettyNioAsyncHttpClient.builder()
                        .maxConcurrency(maxConnections));

        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider(DriverConfig config) {
        String accessKey = config.getString("access-key", "");
        String secretKey = config.getString("secret-key", "");

        if (accessKey.isBlank() && secretKey.isBlank()) {
            log.debug("S3 driver '{}': no static credentials, using default provider chain", config.getName());
            return DefaultCredentialsProvider.create();
        }
        if (accessKey.isBlank() || secretKey.isBlank()) {
            throw new IllegalArgumentException(
                    "S3 driver '" + config.getName() + "': access-key and secret-key must be configured together");
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new S3CreateBucketHandler());
        getHandlerRegistry().register(new S3DeleteBucketHandler());
        getHandlerRegistry().register(new S3BucketExistsHandler());

        getHandlerRegistry().register(new S3UploadFileHandler());
        getHandlerRegistry().register(new S3DownloadFileHandler());
        getHandlerRegistry().register(new S3ObjectExistsHandler());
        getHandlerRegistry().register(new S3ListObjectsHandler());
        getHandlerRegistry().register(new S3DeleteObjectsHandler());

        log.info("Registered {} operation handlers for S3 driver", getHandlerRegistry().size());
    }

    private void registerInterceptors() {
        getHandlerRegistry().addInterceptor(new S3ExceptionTranslationInterceptor());
        log.debug("Registered S3 exception translation interceptor");
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return S3DriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing S3 driver: {} -> {} (transfer manager: {})",
                config.getName(),
                config.getString("endpoint", "AWS S3"),
                transferManager != null);
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down S3 driver: {}", config.getName());
        if (transferManager != null) {
            transferManager.close();
        }
        s3Client.close();
        return Mono.empty();
    }
}
