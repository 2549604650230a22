package io.reactiveactions.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of the effect to apply to an HTTP exchange.
 *
 * <p>Actions are created by controller code (usually through a {@code ResponseActions} helper)
 * and consumed exactly once by the dispatcher. Writing the actual bytes is left to a
 * host-specific applier.
 */
public sealed interface ResponseAction permits ResponseAction.Render, ResponseAction.Respond, ResponseAction.RespondErrors {

    /**
     * Render a named view with a model. Model order is preserved; null values are allowed.
     */
    record Render(String viewName, Map<String, Object> model) implements ResponseAction {
        public Render {
            Objects.requireNonNull(viewName, "viewName");
            model = model == null || model.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(model));
        }

        public Render(String viewName) {
            this(viewName, Map.of());
        }
    }

    /**
     * Respond with a payload (may be null) and a status code.
     */
    record Respond(Object payload, int status, Map<String, List<String>> headers) implements ResponseAction {
        public Respond {
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("status out of range: " + status);
            }
            headers = Headers.immutableCopy(headers);
        }

        public Respond(Object payload, int status) {
            this(payload, status, Map.of());
        }
    }

    /**
     * Respond with validation errors, optionally re-rendering the given view.
     *
     * @param errors the errors (required)
     * @param viewName view to render the errors with; null means write the errors directly
     */
    record RespondErrors(Errors errors, String viewName) implements ResponseAction {
        public RespondErrors {
            Objects.requireNonNull(errors, "errors");
        }
    }
}
