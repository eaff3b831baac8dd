package win.ixuni.cloudbulk.driver.azure.context;

import com.azure.storage.blob.BlobAsyncClient;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.BlobServiceAsyncClient;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudbulk.driver.azure.AzureBlobDriverFactory;

/**
 * Azure Blob driver context
 */
@Getter
@Builder
public class AzureBlobDriverContext implements DriverContext {

    private final DriverConfig config;

    private final BlobServiceAsyncClient serviceClient;

    /**
     * Parallel block transfers per blob
     */
    private final int maxConcurrency;

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return AzureBlobDriverFactory.DRIVER_TYPE;
    }

    public BlobContainerAsyncClient container(String containerName) {
        return serviceClient.getBlobContainerAsyncClient(containerName);
    }

    public BlobAsyncClient blob(String containerName, String blobName) {
        return container(containerName).getBlobAsyncClient(blobName);
    }
}
