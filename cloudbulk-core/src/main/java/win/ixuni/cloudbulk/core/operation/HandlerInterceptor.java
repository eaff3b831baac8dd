package win.ixuni.cloudbulk.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler interceptor interface
 * <p>
 * Inserts common logic around handler execution (logging, exception translation).
 * Chain-of-responsibility.
 */
public interface HandlerInterceptor {

    /**
     * Intercept handler execution
     * <p>
     * Implementors may run logic before and after calling chain.proceed().
     *
     * @param operation the operation instance
     * @param context   driver context
     * @param chain     remaining chain
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain);

    /**
     * Get interceptor priority (lower number = outer position)
     *
     * @return priority ordinal, 0 by default
     */
    default int getOrder() {
        return 0;
    }
}
