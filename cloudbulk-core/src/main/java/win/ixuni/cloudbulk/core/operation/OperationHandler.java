package win.ixuni.cloudbulk.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;

import java.util.Collections;
import java.util.Set;

/**
 * Operation handler interface
 * <p>
 * Each driver provides a handler for every operation it supports.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   driver context
     * @return operation result
     */
    Mono<R> handle(O operation, DriverContext context);

    /**
     * Get the operation type handled by this handler
     *
     * @return operation class
     */
    Class<O> getOperationType();

    /**
     * Get the capabilities this handler contributes
     * <p>
     * The driver's capability set is the union over all registered handlers.
     *
     * @return capability set, empty by default
     */
    default Set<Capability> getProvidedCapabilities() {
        return Collections.emptySet();
    }
}
