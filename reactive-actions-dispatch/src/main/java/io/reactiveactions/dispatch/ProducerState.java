package io.reactiveactions.dispatch;

/**
 * Lifecycle of one subscription to a {@link ResultProducer}.
 *
 * <p>{@link #TERMINATED} and {@link #CANCELLED} are absorbing: no event is delivered after either.
 */
public enum ProducerState {
    /** Created, not yet subscribed. */
    PENDING,
    /** Subscribed and awaiting a terminal event. */
    ACTIVE,
    /** A value, empty completion or failure was delivered. */
    TERMINATED,
    /** Disposed before a terminal event arrived. */
    CANCELLED
}
