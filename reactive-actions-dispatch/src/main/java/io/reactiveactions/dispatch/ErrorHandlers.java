package io.reactiveactions.dispatch;

import io.reactiveactions.core.ReactiveActionsException.ActionTimeout;
import io.reactiveactions.core.ReactiveActionsException.EmptyResult;
import io.reactiveactions.core.ReactiveActionsException.ValidationFailure;
import io.reactiveactions.core.ResponseAction;
import reactor.core.Exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Maps failures to response actions by exception class.
 *
 * <p>Lookup walks the failure's class hierarchy, so the most specific registered type wins.
 * {@link CompletionException} and {@link ExecutionException} wrappers are unwrapped first.
 */
public final class ErrorHandlers {

    private final Map<Class<? extends Throwable>, Function<Throwable, ResponseAction>> handlers;

    private ErrorHandlers(Map<Class<? extends Throwable>, Function<Throwable, ResponseAction>> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    public static ErrorHandlers none() {
        return builder().build();
    }

    /**
     * Default registrations: {@link ValidationFailure} to {@code RespondErrors} (no view) and
     * {@link ActionTimeout} to 503. {@link EmptyResult} is left to the dispatcher, which maps it to
     * its empty action.
     */
    public static ErrorHandlers defaults(ResponseActions actions) {
        Objects.requireNonNull(actions, "actions");
        return builder()
                .on(ValidationFailure.class, e -> actions.respondErrors(e.errors()))
                .on(ActionTimeout.class, e -> actions.status(503))
                .build();
    }

    public Builder toBuilder() {
        return new Builder(handlers);
    }

    public Optional<ResponseAction> resolve(Throwable error) {
        Throwable cause = unwrap(error);
        for (Class<?> c = cause.getClass(); c != null && Throwable.class.isAssignableFrom(c); c = c.getSuperclass()) {
            Function<Throwable, ResponseAction> handler = handlers.get(c);
            if (handler != null) {
                return Optional.ofNullable(handler.apply(cause));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a handler is registered for exactly {@code type}.
     */
    public boolean handles(Class<? extends Throwable> type) {
        return handlers.containsKey(type);
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = Exceptions.unwrap(Objects.requireNonNull(error, "error"));
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Builder for {@link ErrorHandlers}. Registering a type twice replaces the earlier handler.
     */
    public static final class Builder {
        private final Map<Class<? extends Throwable>, Function<Throwable, ResponseAction>> handlers;

        private Builder(Map<Class<? extends Throwable>, Function<Throwable, ResponseAction>> initial) {
            this.handlers = new LinkedHashMap<>(initial);
        }

        public <X extends Throwable> Builder on(Class<X> type, Function<? super X, ? extends ResponseAction> handler) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(handler, "handler");
            handlers.put(type, t -> handler.apply(type.cast(t)));
            return this;
        }

        public ErrorHandlers build() {
            return new ErrorHandlers(handlers);
        }
    }
}
