package io.reactiveactions.dispatch;

import io.reactiveactions.core.ReactiveActionsException.ProtocolViolation;
import io.reactiveactions.core.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Completion flag serializing access to one exchange.
 *
 * <p>The first {@link #apply(ResponseAction)} wins. A second apply is a {@link ProtocolViolation};
 * an apply after {@link #cancel()} is ignored.
 */
public final class ResponseGuard<E extends Exchange> {
    private static final Logger log = LoggerFactory.getLogger(ResponseGuard.class);

    private enum State { OPEN, APPLIED, CANCELLED }

    private final E exchange;
    private final ResponseApplier<? super E> applier;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    public ResponseGuard(E exchange, ResponseApplier<? super E> applier) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.applier = Objects.requireNonNull(applier, "applier");
    }

    /**
     * Applies {@code action} and completes the exchange, even when writing fails.
     *
     * @return true if applied, false if the exchange was cancelled first
     * @throws ProtocolViolation if an action was already applied
     */
    public boolean apply(ResponseAction action) {
        Objects.requireNonNull(action, "action");
        if (!state.compareAndSet(State.OPEN, State.APPLIED)) {
            if (state.get() == State.CANCELLED) {
                log.debug("Dropping {} for cancelled exchange {}", action.getClass().getSimpleName(), exchange.context());
                return false;
            }
            throw new ProtocolViolation("A response was already applied to " + exchange.context());
        }
        try {
            applier.apply(exchange, action);
        } catch (IOException e) {
            log.warn("Failed to write {} to {}", action.getClass().getSimpleName(), exchange.context(), e);
        } catch (RuntimeException e) {
            log.error("Response applier failed on {} for {}", action.getClass().getSimpleName(), exchange.context(), e);
        } finally {
            exchange.complete();
        }
        return true;
    }

    /**
     * @return true if this call cancelled the guard; false if already applied or cancelled
     */
    public boolean cancel() {
        return state.compareAndSet(State.OPEN, State.CANCELLED);
    }

    public boolean isApplied() {
        return state.get() == State.APPLIED;
    }

    public boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }
}
