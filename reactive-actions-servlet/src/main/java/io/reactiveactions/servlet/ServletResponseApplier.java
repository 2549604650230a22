package io.reactiveactions.servlet;

import io.reactiveactions.core.Errors;
import io.reactiveactions.core.FieldError;
import io.reactiveactions.core.ResponseAction;
import io.reactiveactions.dispatch.ResponseApplier;
import io.reactiveactions.json.spi.JsonCodec;
import io.reactiveactions.json.spi.JsonCodecs;
import io.reactiveactions.json.spi.JsonException;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes {@link ResponseAction}s to servlet responses.
 *
 * <p>{@code Respond} payloads are written by type: none for null, {@code text/plain} for
 * character sequences, {@code application/octet-stream} for byte arrays and JSON for anything
 * else. {@code Render} goes through the {@link ViewRenderer}. {@code RespondErrors} answers 422.
 */
public final class ServletResponseApplier implements ResponseApplier<ServletExchange> {
    private static final Logger log = LoggerFactory.getLogger(ServletResponseApplier.class);

    static final String APPLICATION_JSON = "application/json";
    static final String TEXT_PLAIN = "text/plain;charset=UTF-8";
    static final String OCTET_STREAM = "application/octet-stream";

    public static final int UNPROCESSABLE_ENTITY = 422;

    private final JsonCodec codec;
    private final ViewRenderer viewRenderer;

    /**
     * Uses the {@link JsonCodec} registered through {@link JsonCodecs}.
     */
    public ServletResponseApplier() {
        this(JsonCodecs.defaultCodec());
    }

    public ServletResponseApplier(JsonCodec codec) {
        this(codec, new JsonViewRenderer(codec));
    }

    public ServletResponseApplier(JsonCodec codec, ViewRenderer viewRenderer) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.viewRenderer = Objects.requireNonNull(viewRenderer, "viewRenderer");
    }

    @Override
    public void apply(ServletExchange exchange, ResponseAction action) throws IOException {
        HttpServletResponse resp = exchange.response();
        if (action instanceof ResponseAction.Respond respond) {
            writeRespond(resp, respond);
        } else if (action instanceof ResponseAction.Render render) {
            viewRenderer.render(exchange, render.viewName(), render.model());
        } else if (action instanceof ResponseAction.RespondErrors respondErrors) {
            writeErrors(exchange, respondErrors);
        } else {
            throw new IllegalArgumentException("Unsupported action: " + action);
        }
    }

    private void writeRespond(HttpServletResponse resp, ResponseAction.Respond respond) throws IOException {
        Object payload = respond.payload();
        byte[] body;
        String contentType;
        if (payload == null) {
            body = null;
            contentType = null;
        } else if (payload instanceof CharSequence text) {
            body = text.toString().getBytes(StandardCharsets.UTF_8);
            contentType = TEXT_PLAIN;
        } else if (payload instanceof byte[] bytes) {
            body = bytes;
            contentType = OCTET_STREAM;
        } else {
            try {
                body = codec.writeBytes(payload);
            } catch (JsonException e) {
                log.error("Failed to encode {} payload", payload.getClass().getName(), e);
                if (!resp.isCommitted()) {
                    resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
                }
                return;
            }
            contentType = APPLICATION_JSON;
        }

        resp.setStatus(respond.status());
        if (contentType != null) {
            resp.setContentType(contentType);
        }
        respond.headers().forEach((name, values) -> values.forEach(v -> resp.addHeader(name, v)));
        if (body != null) {
            resp.setContentLength(body.length);
            resp.getOutputStream().write(body);
        }
    }

    private void writeErrors(ServletExchange exchange, ResponseAction.RespondErrors respondErrors) throws IOException {
        Errors errors = respondErrors.errors();
        exchange.response().setStatus(UNPROCESSABLE_ENTITY);
        if (respondErrors.viewName() != null) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("errors", errors);
            model.put("objectName", errors.objectName());
            viewRenderer.render(exchange, respondErrors.viewName(), model);
            return;
        }
        HttpServletResponse resp = exchange.response();
        byte[] body;
        try {
            body = codec.writeBytes(toJsonModel(errors));
        } catch (JsonException e) {
            log.error("Failed to encode errors of '{}'", errors.objectName(), e);
            if (!resp.isCommitted()) {
                resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            }
            return;
        }
        resp.setContentType(APPLICATION_JSON);
        resp.setContentLength(body.length);
        resp.getOutputStream().write(body);
    }

    static Map<String, Object> toJsonModel(Errors errors) {
        List<Map<String, Object>> fieldErrors = new ArrayList<>();
        for (FieldError e : errors.fieldErrors()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("field", e.field());
            entry.put("code", e.code());
            entry.put("message", e.message());
            entry.put("rejectedValue", e.rejectedValue());
            fieldErrors.add(entry);
        }
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("objectName", errors.objectName());
        model.put("fieldErrors", fieldErrors);
        model.put("globalErrors", errors.globalErrors());
        return model;
    }
}
