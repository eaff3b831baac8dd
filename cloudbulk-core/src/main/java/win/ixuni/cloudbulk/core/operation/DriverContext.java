package win.ixuni.cloudbulk.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.config.DriverConfig;

/**
 * Driver context interface
 * <p>
 * Provides the SDK client and shared state handlers need to execute operations.
 * Each driver implements its own context class.
 */
public interface DriverContext {

    /**
     * Get the driver configuration
     *
     * @return driver configuration
     */
    DriverConfig getConfig();

    /**
     * Get the driver name
     *
     * @return driver instance name
     */
    String getDriverName();

    /**
     * Get the driver type
     *
     * @return driver type identifier, e.g. "s3", "gcs"
     */
    String getDriverType();

    /**
     * Get the operation handler registry
     *
     * @return handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Set the operation handler registry
     * <p>
     * Called during driver construction to inject the handler registry.
     *
     * @param registry handler registry
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute an operation
     * <p>
     * Allows handlers to invoke other operations without depending on other handler instances.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
