package io.reactiveactions.servlet;

import io.reactiveactions.dispatch.ControllerAction;
import io.reactiveactions.dispatch.ControllerDispatcher;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Servlet bound to a single {@link ControllerAction}. Must be registered with async support.
 *
 * <pre>{@code
 * ServletRegistration.Dynamic reg = ctx.addServlet("books", new ActionServlet(dispatcher,
 *     (req, actions) -> books.list().map(list -> actions.render("index", Map.of("bookList", list)))));
 * reg.setAsyncSupported(true);
 * reg.addMapping("/books");
 * }</pre>
 */
public final class ActionServlet extends HttpServlet {
    private static final Logger log = LoggerFactory.getLogger(ActionServlet.class);

    private final transient ControllerDispatcher<ServletExchange> dispatcher;
    private final transient ControllerAction action;

    public ActionServlet(ControllerDispatcher<ServletExchange> dispatcher, ControllerAction action) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.action = Objects.requireNonNull(action, "action");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) {
        try {
            dispatcher.dispatch(ServletExchange.start(req, resp), action);
        } catch (Exception e) {
            log.error("Failed to dispatch {} {}", req.getMethod(), req.getRequestURI(), e);
            if (!resp.isCommitted()) {
                resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            }
        }
    }
}
