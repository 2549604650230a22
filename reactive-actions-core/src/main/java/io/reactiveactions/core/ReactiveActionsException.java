package io.reactiveactions.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Base class for Reactive Actions related exceptions.
 *
 * <p>Failures coming from data collaborators are {@link UpstreamFailure}s. Broken dispatcher
 * invariants are {@link ProtocolViolation}s and signal a programming defect.
 */
public abstract class ReactiveActionsException extends RuntimeException {

    protected ReactiveActionsException(String message) {
        super(message);
    }

    protected ReactiveActionsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised by (or on behalf of) an upstream data collaborator.
     */
    public static class UpstreamFailure extends ReactiveActionsException {
        public UpstreamFailure(String message) {
            super(message);
        }

        public UpstreamFailure(String message, Throwable cause) {
            super(message, cause);
        }

        public UpstreamFailure(Throwable cause) {
            super(cause == null ? "upstream failure" : String.valueOf(cause.getMessage()), cause);
        }
    }

    /**
     * Upstream failure carrying structured field errors. Usually recovered locally into a
     * {@link ResponseAction.RespondErrors}.
     */
    public static class ValidationFailure extends UpstreamFailure {
        private final Errors errors;

        public ValidationFailure(Errors errors) {
            super(describe(errors));
            this.errors = Objects.requireNonNull(errors, "errors");
        }

        public Errors errors() {
            return errors;
        }

        private static String describe(Errors errors) {
            Objects.requireNonNull(errors, "errors");
            return "Validation failed for '" + errors.objectName() + "' with " + errors.errorCount() + " error(s)";
        }
    }

    /**
     * Raised when a producer completes without a value where one is expected.
     */
    public static class EmptyResult extends ReactiveActionsException {
        public EmptyResult(String message) {
            super(message);
        }
    }

    /**
     * Raised when the exactly-once response invariant is broken, e.g. a second apply on the
     * same exchange.
     */
    public static class ProtocolViolation extends ReactiveActionsException {
        public ProtocolViolation(String message) {
            super(message);
        }
    }

    /**
     * Raised when a non-restartable producer is subscribed more than once.
     */
    public static class AlreadyConsumed extends ProtocolViolation {
        public AlreadyConsumed(String message) {
            super(message);
        }
    }

    /**
     * Raised when a dispatched producer does not terminate within its timeout.
     */
    public static class ActionTimeout extends ReactiveActionsException {
        private final Duration timeout;

        public ActionTimeout(Duration timeout) {
            super("No terminal event within " + timeout.toMillis() + "ms");
            this.timeout = timeout;
        }

        public Duration timeout() {
            return timeout;
        }
    }
}
