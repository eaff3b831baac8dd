package win.ixuni.cloudbulk.core.driver;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.operation.DriverContext;
import win.ixuni.cloudbulk.core.operation.Operation;
import win.ixuni.cloudbulk.core.operation.OperationHandlerRegistry;

/**
 * Storage driver interface
 * <p>
 * Command-pattern architecture where every storage call is executed via {@link #execute(Operation)}.
 * Each driver implements its own handlers on top of one vendor SDK and registers them with the registry.
 */
public interface StorageDriver extends DriverCapabilities {

    // ==================== Core Methods ====================

    /**
     * Get the operation handler registry
     *
     * @return handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Get the driver context
     *
     * @return driver context
     */
    DriverContext getDriverContext();

    /**
     * Execute an operation
     * <p>
     * Unified entry point for all storage operations, with interceptor chain support.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getDriverContext());
    }

    // ==================== Driver Metadata ====================

    /**
     * Get the driver type identifier
     *
     * @return driver type (e.g. "s3", "gcs")
     */
    String getDriverType();

    /**
     * Get the driver instance name
     *
     * @return instance name (as specified in configuration)
     */
    String getDriverName();

    // ==================== Lifecycle ====================

    /**
     * Initialize the driver
     *
     * @return completion signal
     */
    default Mono<Void> initialize() {
        return Mono.empty();
    }

    /**
     * Shut down the driver and release SDK clients
     *
     * @return completion signal
     */
    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}
