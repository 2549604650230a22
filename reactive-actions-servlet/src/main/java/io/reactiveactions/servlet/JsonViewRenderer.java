package io.reactiveactions.servlet;

import io.reactiveactions.json.spi.JsonCodec;
import io.reactiveactions.json.spi.JsonException;

import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the model as a JSON object and ignores the view name. The default renderer when the
 * host provides no template engine.
 */
public final class JsonViewRenderer implements ViewRenderer {
    private static final Logger log = LoggerFactory.getLogger(JsonViewRenderer.class);

    private final JsonCodec codec;

    public JsonViewRenderer(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void render(ServletExchange exchange, String viewName, Map<String, Object> model) throws IOException {
        HttpServletResponse resp = exchange.response();
        byte[] bytes;
        try {
            bytes = codec.writeBytes(model);
        } catch (JsonException e) {
            log.error("Failed to encode model of view '{}'", viewName, e);
            if (!resp.isCommitted()) {
                resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            }
            return;
        }
        resp.setContentType(ServletResponseApplier.APPLICATION_JSON);
        resp.setContentLength(bytes.length);
        resp.getOutputStream().write(bytes);
    }
}
