package win.ixuni.cloudbulk.core.operation;

import reactor.core.publisher.Mono;

/**
 * Interceptor chain
 * <p>
 * Used in interceptors to invoke the next interceptor or the final handler.
 *
 * @param <O> operation type
 * @param <R> result type
 */
@FunctionalInterface
public interface InterceptorChain<O extends Operation<R>, R> {

    /**
     * Continue with the rest of the chain
     *
     * @param operation the operation instance
     * @param context   driver context
     * @return operation result
     */
    Mono<R> proceed(O operation, DriverContext context);
}
