package io.reactiveactions.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseActionTest {

    @Test
    void renderModelKeepsOrderAndNullValues() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("bookList", List.of("b1", "b2"));
        model.put("bookCount", 2L);
        model.put("flash", null);

        ResponseAction.Render render = new ResponseAction.Render("index", model);
        model.clear();

        assertThat(render.model()).containsKeys("bookList", "bookCount", "flash");
        assertThat(render.model().keySet()).containsExactly("bookList", "bookCount", "flash");
        assertThatThrownBy(() -> render.model().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void renderRequiresViewName() {
        assertThatThrownBy(() -> new ResponseAction.Render(null, Map.of()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void respondAllowsNullPayload() {
        ResponseAction.Respond respond = new ResponseAction.Respond(null, 404);

        assertThat(respond.payload()).isNull();
        assertThat(respond.status()).isEqualTo(404);
        assertThat(respond.headers()).isEmpty();
    }

    @Test
    void respondRejectsInvalidStatus() {
        assertThatThrownBy(() -> new ResponseAction.Respond("x", 42))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void respondHeadersAreCopied() {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put("Location", List.of("/books/42"));

        ResponseAction.Respond respond = new ResponseAction.Respond(null, 201, headers);
        headers.clear();

        assertThat(respond.headers().get("location")).containsExactly("/books/42");
    }

    @Test
    void actionsWithEqualContentAreEqual() {
        assertThat(new ResponseAction.Respond("book", 200)).isEqualTo(new ResponseAction.Respond("book", 200));
        Errors errors = Errors.builder("book").rejectValue("title", "blank").build();
        assertThat(new ResponseAction.RespondErrors(errors, "create"))
                .isEqualTo(new ResponseAction.RespondErrors(errors, "create"));
    }
}
