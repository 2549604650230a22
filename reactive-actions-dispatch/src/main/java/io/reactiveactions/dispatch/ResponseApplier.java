package io.reactiveactions.dispatch;

import io.reactiveactions.core.ResponseAction;

import java.io.IOException;

/**
 * Writes a {@link ResponseAction} to an exchange: status, headers, rendered view or payload.
 *
 * <p>Called at most once per exchange, from a worker thread.
 */
@FunctionalInterface
public interface ResponseApplier<E extends Exchange> {
    void apply(E exchange, ResponseAction action) throws IOException;
}
