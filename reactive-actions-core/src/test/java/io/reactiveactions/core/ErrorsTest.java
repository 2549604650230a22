package io.reactiveactions.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorsTest {

    @Test
    void builderCollectsFieldAndGlobalErrors() {
        Errors errors = Errors.builder("book")
                .rejectValue("title", "blank", "Title must not be blank", "")
                .rejectValue("pages", "min")
                .reject("Duplicate book")
                .build();

        assertThat(errors.hasErrors()).isTrue();
        assertThat(errors.errorCount()).isEqualTo(3);
        assertThat(errors.fieldError("title")).get().extracting(FieldError::code).isEqualTo("blank");
        assertThat(errors.fieldError("author")).isEmpty();
        assertThat(errors.globalErrors()).containsExactly("Duplicate book");
    }

    @Test
    void emptyErrorsHaveNoErrors() {
        assertThat(Errors.builder("book").build().hasErrors()).isFalse();
    }

    @Test
    void validationFailureDescribesErrors() {
        Errors errors = Errors.builder("book").rejectValue("title", "blank").build();

        ReactiveActionsException.ValidationFailure failure = new ReactiveActionsException.ValidationFailure(errors);

        assertThat(failure).isInstanceOf(ReactiveActionsException.UpstreamFailure.class);
        assertThat(failure.errors()).isSameAs(errors);
        assertThat(failure.getMessage()).contains("book").contains("1 error");
    }
}
