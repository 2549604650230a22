package io.reactiveactions.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of validation errors for one bound object.
 */
public final class Errors {
    private final String objectName;
    private final List<FieldError> fieldErrors;
    private final List<String> globalErrors;

    public Errors(String objectName, List<FieldError> fieldErrors, List<String> globalErrors) {
        this.objectName = Objects.requireNonNull(objectName, "objectName");
        this.fieldErrors = List.copyOf(Objects.requireNonNull(fieldErrors, "fieldErrors"));
        this.globalErrors = List.copyOf(Objects.requireNonNull(globalErrors, "globalErrors"));
    }

    public Errors(String objectName, List<FieldError> fieldErrors) {
        this(objectName, fieldErrors, List.of());
    }

    public static Builder builder(String objectName) {
        return new Builder(objectName);
    }

    public String objectName() {
        return objectName;
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

    public List<String> globalErrors() {
        return globalErrors;
    }

    public boolean hasErrors() {
        return !fieldErrors.isEmpty() || !globalErrors.isEmpty();
    }

    public int errorCount() {
        return fieldErrors.size() + globalErrors.size();
    }

    public Optional<FieldError> fieldError(String field) {
        for (FieldError e : fieldErrors) {
            if (e.field().equals(field)) return Optional.of(e);
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Errors other)) return false;
        return objectName.equals(other.objectName)
                && fieldErrors.equals(other.fieldErrors)
                && globalErrors.equals(other.globalErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectName, fieldErrors, globalErrors);
    }

    @Override
    public String toString() {
        return "Errors{" + objectName + ", fieldErrors=" + fieldErrors + ", globalErrors=" + globalErrors + '}';
    }

    /**
     * Builder for {@link Errors}.
     */
    public static final class Builder {
        private final String objectName;
        private final List<FieldError> fieldErrors = new ArrayList<>();
        private final List<String> globalErrors = new ArrayList<>();

        private Builder(String objectName) {
            this.objectName = Objects.requireNonNull(objectName, "objectName");
        }

        public Builder rejectValue(String field, String code, String message, Object rejectedValue) {
            fieldErrors.add(new FieldError(field, code, message, rejectedValue));
            return this;
        }

        public Builder rejectValue(String field, String code) {
            fieldErrors.add(new FieldError(field, code));
            return this;
        }

        public Builder reject(String message) {
            globalErrors.add(Objects.requireNonNull(message, "message"));
            return this;
        }

        public Errors build() {
            return new Errors(objectName, fieldErrors, globalErrors);
        }
    }
}
