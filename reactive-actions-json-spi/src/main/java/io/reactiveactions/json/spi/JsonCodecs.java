package io.reactiveactions.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link JsonCodec} lookup backed by {@link ServiceLoader}.
 *
 * <p>The first registered {@link JsonCodecProvider} wins.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static Optional<JsonCodec> find(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) return Optional.of(codec);
        }
        return Optional.empty();
    }

    /**
     * Returns the codec registered on the context class loader.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec defaultCodec() {
        return find(Thread.currentThread().getContextClassLoader())
                .orElseThrow(() -> new IllegalStateException(
                        "No " + JsonCodecProvider.class.getName() + " registered; add reactive-actions-json-jackson"));
    }
}
