package io.reactiveactions.servlet;

import java.io.IOException;
import java.util.Map;

/**
 * Renders a named view with its model onto a servlet response.
 *
 * <p>Called on a worker thread while the request is in async mode.
 */
@FunctionalInterface
public interface ViewRenderer {
    void render(ServletExchange exchange, String viewName, Map<String, Object> model) throws IOException;
}
