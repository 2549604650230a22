/**
 * Asynchronous dispatch of controller actions.
 *
 * <p>A {@link io.reactiveactions.dispatch.ControllerAction} returns a
 * {@link io.reactiveactions.dispatch.ResultProducer} of a response action. The
 * {@link io.reactiveactions.dispatch.ControllerDispatcher} subscribes to it on a worker scheduler
 * and applies the terminal outcome to the exchange exactly once, through a host-specific
 * {@link io.reactiveactions.dispatch.ResponseApplier}.
 */
package io.reactiveactions.dispatch;
