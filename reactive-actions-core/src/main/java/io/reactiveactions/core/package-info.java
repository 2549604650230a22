/**
 * Framework-neutral core for Reactive Actions.
 *
 * <p>This module contains only small immutable models:
 * <ul>
 *   <li>{@link io.reactiveactions.core.ResponseAction} (the effect applied to an HTTP exchange)</li>
 *   <li>{@link io.reactiveactions.core.ExchangeContext} (request data captured before any async stage)</li>
 *   <li>{@link io.reactiveactions.core.Errors} (structured validation errors)</li>
 *   <li>The {@link io.reactiveactions.core.ReactiveActionsException} hierarchy</li>
 * </ul>
 *
 * <p>Dispatching and host-framework bindings live in other modules.
 */
package io.reactiveactions.core;
