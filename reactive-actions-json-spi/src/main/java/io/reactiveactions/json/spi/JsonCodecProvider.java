package io.reactiveactions.json.spi;

/**
 * ServiceLoader hook for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
