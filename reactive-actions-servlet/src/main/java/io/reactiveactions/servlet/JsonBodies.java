package io.reactiveactions.servlet;

import io.reactiveactions.core.Errors;
import io.reactiveactions.core.ExchangeContext;
import io.reactiveactions.core.ReactiveActionsException.ValidationFailure;
import io.reactiveactions.dispatch.ResultProducer;
import io.reactiveactions.json.spi.JsonCodec;
import io.reactiveactions.json.spi.JsonException;

import java.util.List;
import java.util.Objects;

/**
 * Decodes JSON request bodies captured in an {@link ExchangeContext}.
 *
 * <p>The producers complete empty when the request had no body. A body that cannot be decoded
 * fails with {@link ValidationFailure}, which the default error handlers answer with 422:
 * <pre>{@code
 * (ctx, actions) -> bodies.read(ctx, Book.class)
 *     .switchMap(books::save)
 *     .map(saved -> actions.created(saved, "/books/" + saved.id()))
 * }</pre>
 */
public final class JsonBodies {
    private final JsonCodec codec;

    public JsonBodies(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public <T> ResultProducer<T> read(ExchangeContext context, Class<T> type) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(type, "type");
        return ResultProducer.fromCallable(() -> {
            if (!context.hasBody()) {
                return null;
            }
            try {
                return codec.readValue(context.body(), type);
            } catch (JsonException e) {
                throw malformed(type, e);
            }
        });
    }

    public <T> ResultProducer<List<T>> readList(ExchangeContext context, Class<T> elementType) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(elementType, "elementType");
        return ResultProducer.fromCallable(() -> {
            if (!context.hasBody()) {
                return null;
            }
            try {
                return codec.readList(context.body(), elementType);
            } catch (JsonException e) {
                throw malformed(elementType, e);
            }
        });
    }

    private static String objectName(Class<?> type) {
        String name = type.getSimpleName();
        return name.isEmpty() ? "body" : Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    private static ValidationFailure malformed(Class<?> type, JsonException e) {
        Errors errors = Errors.builder(objectName(type))
                .reject("Malformed JSON body")
                .build();
        ValidationFailure failure = new ValidationFailure(errors);
        failure.initCause(e);
        return failure;
    }
}
