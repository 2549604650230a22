package io.reactiveactions.dispatch;

import io.reactiveactions.core.ExchangeContext;

/**
 * Host adapter's handle on one in-flight HTTP request/response pair.
 */
public interface Exchange {

    /**
     * Request data captured before dispatching. Must be cheap and safe to call repeatedly.
     */
    ExchangeContext context();

    /**
     * Registers a callback fired when the exchange is aborted externally (client disconnect,
     * container timeout). Fired at most once, possibly on another thread; fired immediately if
     * the exchange is already aborted.
     */
    void onAbort(Runnable callback);

    /**
     * Marks the exchange complete after a response was applied.
     */
    void complete();
}
