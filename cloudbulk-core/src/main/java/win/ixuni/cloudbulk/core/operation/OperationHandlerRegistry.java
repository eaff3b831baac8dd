package win.ixuni.cloudbulk.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handler lookup and interceptor pipeline of one driver
 * <p>
 * A driver registers one handler per operation class while it is constructed. Each
 * {@link #execute} call resolves the handler by the runtime class of the operation and wraps
 * it in the interceptors, lowest order outermost.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlersByOperation = new ConcurrentHashMap<>();

    /**
     * Sorted, immutable; replaced as a whole on every addition
     */
    private volatile List<HandlerInterceptor> pipeline = List.of();

    /**
     * Register a handler; a later registration for the same operation wins
     */
    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        OperationHandler<?, ?> previous = handlersByOperation.put(handler.getOperationType(), handler);
        if (previous != null) {
            log.debug("Replaced handler {} with {} for {}", previous.getClass().getSimpleName(),
                    handler.getClass().getSimpleName(), handler.getOperationType().getSimpleName());
        }
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> next = new ArrayList<>(pipeline);
        next.add(interceptor);
        next.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        pipeline = List.copyOf(next);
        log.debug("Interceptor {} installed at order {}", interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * Run an operation through the interceptors and its handler
     *
     * @return the handler's result, or {@link UnsupportedOperationException} when nothing handles the operation
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlersByOperation.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operation.getClass().getSimpleName()));
        }

        List<HandlerInterceptor> interceptors = pipeline;
        InterceptorChain<O, R> chain = handler::handle;
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = interceptors.get(i);
            InterceptorChain<O, R> inner = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, inner);
        }

        InterceptorChain<O, R> head = chain;
        return Mono.defer(() -> head.proceed(operation, context));
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlersByOperation.containsKey(operationType);
    }

    /**
     * Number of operations with a handler
     */
    public int size() {
        return handlersByOperation.size();
    }

    public int interceptorCount() {
        return pipeline.size();
    }

    /**
     * Capabilities of the driver: the union of what its handlers declare
     */
    public Set<Capability> getAggregatedCapabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        handlersByOperation.values().forEach(handler -> capabilities.addAll(handler.getProvidedCapabilities()));
        return capabilities;
    }
}
