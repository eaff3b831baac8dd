package win.ixuni.cloudbulk.test;

import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.driver.DriverFactoryLoader;
import win.ixuni.cloudbulk.core.driver.StorageDriver;

import java.util.Map;

/**
 * Runs the bulk scenario against Azurite, skipped without Docker
 */
@Testcontainers(disabledWithoutDocker = true)
class AzureBlobBulkTransferScenarioTest extends AbstractBulkTransferScenarioTest {

    private static final int BLOB_PORT = 10000;

    // well-known Azurite development account key
    private static final String ACCOUNT_KEY =
            "Eby8vdM02xNOcqFlqUwJPLlmEtlCDXJ1OUzFT50uSRZ6IFsuFq2UVErCz4I6tq/K1SZFPTOtr/KBHBeksoGMGw==";

    @Container
    static final GenericContainer<?> AZURITE = new GenericContainer<>(
            DockerImageName.parse("mcr.microsoft.com/azure-storage/azurite:3.30.0"))
            .withCommand("azurite-blob", "--blobHost", "0.0.0.0", "--blobPort", String.valueOf(BLOB_PORT),
                    "--skipApiVersionCheck")
            .withExposedPorts(BLOB_PORT);

    @Override
    protected StorageDriver createDriver() {
        String connectionString = "DefaultEndpointsProtocol=http;AccountName=devstoreaccount1;"
                + "AccountKey=" + ACCOUNT_KEY + ";"
                + "BlobEndpoint=http://" + AZURITE.getHost() + ":" + AZURITE.getMappedPort(BLOB_PORT)
                + "/devstoreaccount1;";
        return DriverFactoryLoader.createDriver(DriverConfig.of("azurite", "azure-blob", Map.of(
                "connection-string", connectionString)));
    }
}
