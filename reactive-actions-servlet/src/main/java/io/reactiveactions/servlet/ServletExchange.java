package io.reactiveactions.servlet;

import io.reactiveactions.core.ExchangeContext;
import io.reactiveactions.dispatch.Exchange;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Exchange} over a servlet request in async mode.
 *
 * <p>{@link #start(HttpServletRequest, HttpServletResponse)} captures the request on the
 * container thread and switches the request to async processing. Container timeouts and I/O
 * errors reported through {@link AsyncListener} abort the exchange.
 */
public final class ServletExchange implements Exchange {
    private static final Logger log = LoggerFactory.getLogger(ServletExchange.class);

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final AsyncContext async;
    private final ExchangeContext context;
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicReference<Runnable> abortCallback = new AtomicReference<>();

    private ServletExchange(HttpServletRequest request, HttpServletResponse response, AsyncContext async, ExchangeContext context) {
        this.request = request;
        this.response = response;
        this.async = async;
        this.context = context;
    }

    /**
     * Starts async processing with no container timeout; the dispatcher enforces its own.
     */
    public static ServletExchange start(HttpServletRequest request, HttpServletResponse response) throws IOException {
        return start(request, response, 0);
    }

    /**
     * @param asyncTimeoutMillis container async timeout, 0 for none
     */
    public static ServletExchange start(HttpServletRequest request, HttpServletResponse response, long asyncTimeoutMillis)
            throws IOException {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(response, "response");
        // form bodies are exposed through the parameters
        byte[] body = isFormPost(request) ? new byte[0] : readBody(request);
        ExchangeContext context = snapshot(request, body);

        AsyncContext async = request.startAsync(request, response);
        async.setTimeout(asyncTimeoutMillis);
        ServletExchange exchange = new ServletExchange(request, response, async, context);
        async.addListener(exchange.new Listener());
        return exchange;
    }

    @Override
    public ExchangeContext context() {
        return context;
    }

    public HttpServletRequest request() {
        return request;
    }

    public HttpServletResponse response() {
        return response;
    }

    @Override
    public void onAbort(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        abortCallback.set(callback);
        if (aborted.get() && abortCallback.compareAndSet(callback, null)) {
            callback.run();
        }
    }

    @Override
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            async.complete();
        }
    }

    public boolean isCompleted() {
        return completed.get();
    }

    public boolean isAborted() {
        return aborted.get();
    }

    void abort() {
        if (aborted.compareAndSet(false, true)) {
            Runnable callback = abortCallback.getAndSet(null);
            if (callback != null) {
                callback.run();
            }
        }
    }

    private final class Listener implements AsyncListener {
        @Override
        public void onComplete(AsyncEvent event) {
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            log.warn("Container async timeout for {}", context);
            abort();
            if (!response.isCommitted()) {
                response.setStatus(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
            }
            complete();
        }

        @Override
        public void onError(AsyncEvent event) {
            log.debug("Async error for {}", context, event.getThrowable());
            abort();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
        }
    }

    private static ExchangeContext snapshot(HttpServletRequest req, byte[] body) {
        String query = req.getQueryString();
        URI uri = URI.create(req.getRequestURL().toString() + (query == null ? "" : "?" + query));
        ExchangeContext.Builder builder = ExchangeContext.builder(req.getMethod(), uri).body(body);

        req.getParameterMap().forEach((name, values) -> builder.param(name, values));

        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            List<String> values = Collections.list(req.getHeaders(name));
            values.forEach(v -> builder.header(name, v));
        }

        Enumeration<String> attributes = req.getAttributeNames();
        while (attributes.hasMoreElements()) {
            String name = attributes.nextElement();
            builder.attribute(name, req.getAttribute(name));
        }
        return builder.build();
    }

    private static boolean isFormPost(HttpServletRequest req) {
        String contentType = req.getContentType();
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded");
    }

    private static byte[] readBody(HttpServletRequest req) throws IOException {
        if (req.getContentLengthLong() == 0) {
            return new byte[0];
        }
        try (InputStream in = req.getInputStream()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[8192];
            int r;
            while ((r = in.read(buf)) >= 0) {
                out.write(buf, 0, r);
            }
            return out.toByteArray();
        }
    }
}
