package io.reactiveactions.core;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of request data.
 *
 * <p>Host adapters capture the snapshot on the request thread before the action's producer is
 * subscribed. Transformation stages running on worker threads only ever see this snapshot, never
 * the live request.
 */
public final class ExchangeContext {
    private static final byte[] NO_BODY = new byte[0];

    private final String method;
    private final URI uri;
    private final Map<String, List<String>> parameters;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final Map<String, Object> attributes;

    private ExchangeContext(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method");
        this.uri = Objects.requireNonNull(builder.uri, "uri");
        this.parameters = copyMulti(builder.parameters);
        this.headers = Headers.immutableCopy(builder.headers);
        this.body = builder.body == null ? NO_BODY : builder.body.clone();
        this.attributes = builder.attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder(String method, URI uri) {
        return new Builder(method, uri);
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> parameters() {
        return parameters;
    }

    public Optional<String> param(String name) {
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.ofNullable(values.get(0));
    }

    public List<String> params(String name) {
        return parameters.getOrDefault(name, List.of());
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    /**
     * Returns a copy of the request body; empty when the request had none.
     */
    public byte[] body() {
        return body.clone();
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public String bodyAsString() {
        return bodyAsString(StandardCharsets.UTF_8);
    }

    public String bodyAsString(Charset charset) {
        return new String(body, charset);
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> attribute(String name, Class<T> type) {
        Object value = attributes.get(name);
        return type.isInstance(value) ? Optional.of((T) value) : Optional.empty();
    }

    @Override
    public String toString() {
        return "ExchangeContext{" + method + ' ' + uri + '}';
    }

    private static Map<String, List<String>> copyMulti(Map<String, List<String>> source) {
        if (source.isEmpty()) return Map.of();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builder for {@link ExchangeContext}.
     */
    public static final class Builder {
        private final String method;
        private final URI uri;
        private final Map<String, List<String>> parameters = new LinkedHashMap<>();
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private byte[] body;

        private Builder(String method, URI uri) {
            this.method = Objects.requireNonNull(method, "method");
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public Builder param(String name, String... values) {
            parameters.computeIfAbsent(Objects.requireNonNull(name, "name"), k -> new ArrayList<>())
                    .addAll(List.of(values));
            return this;
        }

        public Builder parameters(Map<String, ? extends List<String>> parameters) {
            parameters.forEach((k, v) -> {
                if (k != null && v != null) {
                    this.parameters.computeIfAbsent(k, key -> new ArrayList<>()).addAll(v);
                }
            });
            return this;
        }

        public Builder header(String name, String value) {
            headers.computeIfAbsent(Objects.requireNonNull(name, "name"), k -> new ArrayList<>())
                    .add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, ? extends List<String>> headers) {
            headers.forEach((k, v) -> {
                if (k != null && v != null) {
                    this.headers.computeIfAbsent(k, key -> new ArrayList<>()).addAll(v);
                }
            });
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder attribute(String name, Object value) {
            attributes.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public ExchangeContext build() {
            return new ExchangeContext(this);
        }
    }
}
