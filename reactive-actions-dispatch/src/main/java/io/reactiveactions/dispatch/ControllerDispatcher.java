package io.reactiveactions.dispatch;

import io.reactiveactions.core.ExchangeContext;
import io.reactiveactions.core.ReactiveActionsException.ActionTimeout;
import io.reactiveactions.core.ReactiveActionsException.EmptyResult;
import io.reactiveactions.core.ReactiveActionsException.ProtocolViolation;
import io.reactiveactions.core.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Binds the producer returned by a controller action to an HTTP exchange.
 *
 * <p>The producer is subscribed on a worker scheduler, never on the calling thread. Its terminal
 * event is turned into exactly one {@link ResponseAction}:
 * <ul>
 *   <li>a value is applied as is;</li>
 *   <li>an empty completion applies the configured empty action (default 404);</li>
 *   <li>a failure applies the action registered in {@link ErrorHandlers} for its type, or the
 *       failure action (default 500) after logging it.</li>
 * </ul>
 *
 * <p>Use {@link #builder(ResponseApplier)} to create instances with custom configuration:
 * <pre>{@code
 * ControllerDispatcher<ServletExchange> dispatcher = ControllerDispatcher.builder(applier)
 *     .timeout(Duration.ofSeconds(10))
 *     .workerThreads(16)
 *     .errorHandlers(ErrorHandlers.defaults(actions).toBuilder()
 *         .on(AccessDenied.class, e -> actions.status(403))
 *         .build())
 *     .build();
 * }</pre>
 *
 * @param <E> exchange type of the host adapter
 */
public final class ControllerDispatcher<E extends Exchange> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ControllerDispatcher.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Disables the dispatch timeout.
     */
    public static final Duration NO_TIMEOUT = Duration.ZERO;

    public static final String DEFAULT_THREAD_NAME_PREFIX = "reactive-actions";

    private final ResponseApplier<? super E> applier;
    private final ResponseActions actions;
    private final ErrorHandlers errorHandlers;
    private final ResponseAction emptyAction;
    private final ResponseAction failureAction;
    private final Duration timeout;
    private final Scheduler scheduler;
    private final ExecutorService ownedExecutor; // null when the scheduler was supplied

    /**
     * Creates a new builder for configuring a dispatcher.
     *
     * @param applier writes actions to exchanges (required)
     * @return a new builder instance
     */
    public static <E extends Exchange> Builder<E> builder(ResponseApplier<? super E> applier) {
        return new Builder<>(applier);
    }

    public ControllerDispatcher(ResponseApplier<? super E> applier) {
        this(builder(applier));
    }

    private ControllerDispatcher(Builder<E> builder) {
        this.applier = Objects.requireNonNull(builder.applier, "applier");
        this.actions = builder.actions != null ? builder.actions : new ResponseActions();
        ResponseAction empty = builder.emptyAction != null ? builder.emptyAction : actions.notFound();
        this.emptyAction = empty;
        ErrorHandlers handlers = builder.errorHandlers != null ? builder.errorHandlers : ErrorHandlers.defaults(actions);
        this.errorHandlers = handlers.handles(EmptyResult.class)
                ? handlers
                : handlers.toBuilder().on(EmptyResult.class, e -> empty).build();
        this.failureAction = builder.failureAction != null ? builder.failureAction : actions.serverError();
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownedExecutor = null;
        } else {
            String prefix = builder.threadNamePrefix != null ? builder.threadNamePrefix : DEFAULT_THREAD_NAME_PREFIX;
            int threads = builder.workerThreads > 0 ? builder.workerThreads : WorkerThreads.defaultThreadCount();
            this.ownedExecutor = WorkerThreads.newExecutor(prefix, threads);
            this.scheduler = WorkerThreads.schedulerFor(ownedExecutor, prefix);
        }
    }

    /**
     * Builder for {@link ControllerDispatcher}.
     */
    public static final class Builder<E extends Exchange> {
        private final ResponseApplier<? super E> applier;
        private ResponseActions actions;
        private ErrorHandlers errorHandlers;
        private ResponseAction emptyAction;
        private ResponseAction failureAction;
        private Duration timeout;
        private Scheduler scheduler;
        private int workerThreads;
        private String threadNamePrefix;

        private Builder(ResponseApplier<? super E> applier) {
            this.applier = Objects.requireNonNull(applier, "applier");
        }

        /** Sets the helper handed to controller actions. Default: a new {@link ResponseActions}. */
        public Builder<E> responseActions(ResponseActions actions) {
            this.actions = actions;
            return this;
        }

        /**
         * Sets the failure mapping. Default: {@link ErrorHandlers#defaults(ResponseActions)}.
         *
         * <p>Unless {@code errorHandlers} registers {@link EmptyResult} itself, it is mapped to the
         * empty action.
         */
        public Builder<E> errorHandlers(ErrorHandlers errorHandlers) {
            this.errorHandlers = errorHandlers;
            return this;
        }

        /** Sets the action applied when a producer completes empty. Default: 404. */
        public Builder<E> emptyAction(ResponseAction emptyAction) {
            this.emptyAction = emptyAction;
            return this;
        }

        /** Sets the action applied for failures without a registered handler. Default: 500. */
        public Builder<E> failureAction(ResponseAction failureAction) {
            this.failureAction = failureAction;
            return this;
        }

        /**
         * Sets the default dispatch timeout. Default: 30 seconds.
         *
         * <p>Use {@link ControllerDispatcher#NO_TIMEOUT} to disable.
         */
        public Builder<E> timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the worker scheduler. The dispatcher does not dispose a supplied scheduler.
         * Default: a fixed pool owned by the dispatcher.
         */
        public Builder<E> scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /** Sets the size of the owned worker pool. Default: twice the available processors. */
        public Builder<E> workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        /** Sets the name prefix of owned worker threads. Default: {@code reactive-actions}. */
        public Builder<E> threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /** Builds the dispatcher with the configured settings. */
        public ControllerDispatcher<E> build() {
            return new ControllerDispatcher<>(this);
        }
    }

    public ResponseActions actions() {
        return actions;
    }

    public ErrorHandlers errorHandlers() {
        return errorHandlers;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Captures the exchange context, invokes {@code action} on the calling thread and dispatches
     * the producer it returns. An exception thrown by the action, or a null producer, is handled
     * like a failure of the producer.
     */
    public DispatchHandle dispatch(E exchange, ControllerAction action) {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(action, "action");
        ExchangeContext context = exchange.context();
        ResultProducer<ResponseAction> producer;
        try {
            producer = action.handle(context, actions);
        } catch (RuntimeException e) {
            producer = ResultProducer.error(e);
        }
        if (producer == null) {
            producer = ResultProducer.error(new ProtocolViolation("Controller action returned no producer for " + context));
        }
        return dispatch(exchange, producer);
    }

    public DispatchHandle dispatch(E exchange, ResultProducer<ResponseAction> producer) {
        return dispatch(exchange, producer, timeout);
    }

    /**
     * Dispatches {@code producer} with a per-call timeout ({@link #NO_TIMEOUT} disables it).
     */
    public DispatchHandle dispatch(E exchange, ResultProducer<ResponseAction> producer, Duration timeout) {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(timeout, "timeout");

        ResponseGuard<E> guard = new ResponseGuard<>(exchange, applier);
        DispatchHandle handle = new DispatchHandle(guard);
        exchange.onAbort(() -> {
            if (handle.cancel()) {
                log.debug("Exchange {} aborted before a response was applied", exchange.context());
            }
        });
        if (handle.isCancelled()) {
            return handle;
        }

        ResultProducer<ResponseAction> scheduled = producer.subscribeOn(scheduler);
        if (!timeout.isZero() && !timeout.isNegative()) {
            scheduled = scheduled.timeout(timeout);
        }
        handle.attach(scheduled.subscribe(new ResultObserver<>() {
            @Override
            public void onValue(ResponseAction action) {
                guard.apply(action);
            }

            @Override
            public void onEmpty() {
                guard.apply(emptyAction);
            }

            @Override
            public void onError(Throwable error) {
                guard.apply(actionFor(error, exchange));
            }
        }));
        return handle;
    }

    private ResponseAction actionFor(Throwable error, E exchange) {
        Throwable cause = ErrorHandlers.unwrap(error);
        Optional<ResponseAction> handled;
        try {
            handled = errorHandlers.resolve(error);
        } catch (RuntimeException handlerFailure) {
            handlerFailure.addSuppressed(cause);
            log.error("Error handler for {} failed while dispatching {}",
                    cause.getClass().getSimpleName(), exchange.context(), handlerFailure);
            return failureAction;
        }
        if (handled.isPresent()) {
            if (cause instanceof ActionTimeout) {
                log.warn("Action for {} timed out: {}", exchange.context(), cause.getMessage());
            } else {
                log.debug("Handled {} for {}", cause.getClass().getSimpleName(), exchange.context(), cause);
            }
            return handled.get();
        }
        if (cause instanceof ProtocolViolation) {
            log.error("Protocol violation while dispatching {}", exchange.context(), cause);
        } else {
            log.error("Unhandled failure while dispatching {}", exchange.context(), cause);
        }
        return failureAction;
    }

    /**
     * Releases the worker pool if this dispatcher created it.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            scheduler.dispose();
            ownedExecutor.shutdownNow();
        }
    }
}
