package io.reactiveactions.dispatch;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Operators;
import reactor.util.context.Context;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on one subscription to a {@link ResultProducer}.
 *
 * <p>Tracks the subscription state machine and guarantees the observer sees at most one terminal
 * event. Events arriving after {@link #cancel()} are dropped.
 */
public final class ProducerSubscription {

    private final AtomicReference<ProducerState> state = new AtomicReference<>(ProducerState.PENDING);
    private volatile Disposable disposable;

    private ProducerSubscription() {
    }

    static <T> ProducerSubscription start(Mono<T> source, ResultObserver<? super T> observer) {
        Objects.requireNonNull(observer, "observer");
        ProducerSubscription subscription = new ProducerSubscription();
        subscription.state.set(ProducerState.ACTIVE);
        Disposable d = source.subscribe(
                value -> {
                    if (subscription.terminate()) {
                        observer.onValue(value);
                    }
                },
                error -> {
                    if (subscription.terminate()) {
                        observer.onError(error);
                    } else if (subscription.state() == ProducerState.TERMINATED) {
                        // raised by the observer itself after the terminal event
                        Operators.onErrorDropped(error, Context.empty());
                    }
                },
                () -> {
                    if (subscription.terminate()) {
                        observer.onEmpty();
                    }
                });
        subscription.disposable = d;
        if (subscription.state() == ProducerState.CANCELLED) {
            d.dispose();
        }
        return subscription;
    }

    public ProducerState state() {
        return state.get();
    }

    public boolean isTerminated() {
        return state.get() == ProducerState.TERMINATED;
    }

    /**
     * Cancels the subscription if it has not terminated yet.
     *
     * @return true if this call moved the subscription to {@link ProducerState#CANCELLED}
     */
    public boolean cancel() {
        ProducerState current = state.get();
        while (current == ProducerState.PENDING || current == ProducerState.ACTIVE) {
            if (state.compareAndSet(current, ProducerState.CANCELLED)) {
                Disposable d = disposable;
                if (d != null) {
                    d.dispose();
                }
                return true;
            }
            current = state.get();
        }
        return false;
    }

    private boolean terminate() {
        return state.compareAndSet(ProducerState.ACTIVE, ProducerState.TERMINATED);
    }
}
