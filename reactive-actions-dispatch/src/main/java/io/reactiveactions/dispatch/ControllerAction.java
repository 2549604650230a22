package io.reactiveactions.dispatch;

import io.reactiveactions.core.ExchangeContext;
import io.reactiveactions.core.ResponseAction;

/**
 * A controller action that answers with a producer instead of a direct value.
 *
 * <p>Invoked on the request thread; it should only assemble the producer chain. Anything the
 * chain needs from the request must be read from {@code context}.
 */
@FunctionalInterface
public interface ControllerAction {
    ResultProducer<ResponseAction> handle(ExchangeContext context, ResponseActions actions);
}
