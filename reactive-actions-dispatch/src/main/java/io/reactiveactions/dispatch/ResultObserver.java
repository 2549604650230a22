package io.reactiveactions.dispatch;

/**
 * Receives the single terminal event of a {@link ResultProducer} subscription.
 *
 * <p>Exactly one of the three methods is invoked, at most once, on whichever thread the
 * producer terminated on.
 */
public interface ResultObserver<T> {

    void onValue(T value);

    void onEmpty();

    void onError(Throwable error);
}
