package io.reactiveactions.dispatch;

import io.reactiveactions.core.Errors;
import io.reactiveactions.core.ResponseAction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factory for {@link ResponseAction}s handed to controller actions.
 *
 * <p>An explicit instance rather than static helpers, so hosts can pass or replace it.
 */
public final class ResponseActions {

    public ResponseAction render(String viewName) {
        return new ResponseAction.Render(viewName);
    }

    public ResponseAction render(String viewName, Map<String, ?> model) {
        return new ResponseAction.Render(viewName, model == null ? Map.of() : new LinkedHashMap<String, Object>(model));
    }

    /** 200 with the given payload. */
    public ResponseAction respond(Object payload) {
        return new ResponseAction.Respond(payload, 200);
    }

    public ResponseAction respond(Object payload, int status) {
        return new ResponseAction.Respond(payload, status);
    }

    public ResponseAction respond(Object payload, int status, Map<String, List<String>> headers) {
        return new ResponseAction.Respond(payload, status, headers);
    }

    /** 201 with a {@code Location} header. */
    public ResponseAction created(Object payload, String location) {
        return new ResponseAction.Respond(payload, 201, Map.of("Location", List.of(Objects.requireNonNull(location, "location"))));
    }

    public ResponseAction status(int status) {
        return new ResponseAction.Respond(null, status);
    }

    public ResponseAction notFound() {
        return status(404);
    }

    public ResponseAction serverError() {
        return status(500);
    }

    public ResponseAction respondErrors(Errors errors) {
        return new ResponseAction.RespondErrors(errors, null);
    }

    public ResponseAction respondErrors(Errors errors, String viewName) {
        return new ResponseAction.RespondErrors(errors, viewName);
    }
}
