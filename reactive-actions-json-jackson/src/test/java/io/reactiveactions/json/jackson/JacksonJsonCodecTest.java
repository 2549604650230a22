package io.reactiveactions.json.jackson;

import io.reactiveactions.json.spi.JsonCodec;
import io.reactiveactions.json.spi.JsonCodecs;
import io.reactiveactions.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    record Book(String id, String title) {}

    @Test
    void writesRecordsAsObjects() throws Exception {
        JsonCodec codec = new JacksonJsonCodec();

        String json = new String(codec.writeBytes(new Book("42", "Dune")), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"id\":\"42\",\"title\":\"Dune\"}");
    }

    @Test
    void readsTypedValuesAndLists() throws Exception {
        JsonCodec codec = new JacksonJsonCodec();

        Book book = codec.readValue("{\"id\":\"7\",\"title\":\"Emma\"}".getBytes(StandardCharsets.UTF_8), Book.class);
        List<Book> books = codec.readList(
                "[{\"id\":\"1\",\"title\":\"A\"},{\"id\":\"2\",\"title\":\"B\"}]".getBytes(StandardCharsets.UTF_8),
                Book.class);

        assertThat(book).isEqualTo(new Book("7", "Emma"));
        assertThat(books).extracting(Book::id).containsExactly("1", "2");
    }

    @Test
    void malformedInputRaisesJsonException() {
        JsonCodec codec = new JacksonJsonCodec();

        assertThatThrownBy(() -> codec.readValue("{not json".getBytes(StandardCharsets.UTF_8), Map.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("java.util.Map");
    }

    @Test
    void emptyBeansSerializeAsEmptyObject() throws Exception {
        assertThat(new JacksonJsonCodec().writeBytes(new Object())).asString(StandardCharsets.UTF_8).isEqualTo("{}");
    }

    @Test
    void providerIsDiscoveredThroughServiceLoader() {
        assertThat(JsonCodecs.find(getClass().getClassLoader()))
                .get()
                .isInstanceOf(JacksonJsonCodec.class);
    }
}
