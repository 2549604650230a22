/**
 * JSON SPI used by host adapters to encode response payloads and decode request bodies.
 *
 * <p>Implementations register a {@link io.reactiveactions.json.spi.JsonCodecProvider} with
 * {@link java.util.ServiceLoader}.
 */
package io.reactiveactions.json.spi;
