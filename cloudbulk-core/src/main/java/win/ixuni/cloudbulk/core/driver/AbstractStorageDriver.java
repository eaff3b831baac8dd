package win.ixuni.cloudbulk.core.driver;

import lombok.Getter;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudbulk.core.operation.OperationHandlerRegistry;
import win.ixuni.cloudbulk.core.operation.interceptor.LoggingInterceptor;

import java.util.Set;

/**
 * Abstract base class for storage drivers
 * <p>
 * Owns the handler registry and installs the logging interceptor; subclasses build their
 * SDK client and register handlers.
 */
public abstract class AbstractStorageDriver implements StorageDriver {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractStorageDriver() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
    }

    @Override
    public Set<Capability> getCapabilities() {
        // Aggregated from all registered handler-declared capabilities
        return handlerRegistry.getAggregatedCapabilities();
    }
}
