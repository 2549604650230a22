package io.reactiveactions.dispatch;

import java.util.Objects;
import java.util.Optional;

/**
 * Handle on one dispatched exchange.
 */
public final class DispatchHandle {
    private final ResponseGuard<?> guard;
    private volatile ProducerSubscription subscription;

    DispatchHandle(ResponseGuard<?> guard) {
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    void attach(ProducerSubscription subscription) {
        this.subscription = subscription;
        if (guard.isCancelled()) {
            subscription.cancel();
        }
    }

    /**
     * Cancels the dispatch: no response will be applied and the producer is unsubscribed.
     *
     * @return true if the response had not been applied yet
     */
    public boolean cancel() {
        boolean cancelled = guard.cancel();
        ProducerSubscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        return cancelled;
    }

    public boolean isApplied() {
        return guard.isApplied();
    }

    public boolean isCancelled() {
        return guard.isCancelled();
    }

    /**
     * State of the producer subscription; empty if the exchange was aborted before subscribing.
     */
    public Optional<ProducerState> producerState() {
        ProducerSubscription s = subscription;
        return s == null ? Optional.empty() : Optional.of(s.state());
    }
}
