package io.reactiveactions.dispatch;

import io.reactiveactions.core.ReactiveActionsException.UpstreamFailure;
import io.reactiveactions.core.ResponseAction;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CombinationHelperTest {

    private final CombinationHelper helper = new CombinationHelper(new ResponseActions());

    @Test
    void combinesItemsAndCount() {
        StepVerifier.create(helper.<String>combine(ResultProducer.just(List.of("b1", "b2")), ResultProducer.just(2)).toMono())
                .assertNext(result -> {
                    assertThat(result.items()).containsExactly("b1", "b2");
                    assertThat(result.count()).isEqualTo(2L);
                })
                .verifyComplete();
    }

    @Test
    void rendersListModel() {
        StepVerifier.create(helper.renderList("index", "book",
                        ResultProducer.just(List.of("b1", "b2")), ResultProducer.just(2L)).toMono())
                .assertNext(action -> {
                    assertThat(action).isInstanceOf(ResponseAction.Render.class);
                    ResponseAction.Render render = (ResponseAction.Render) action;
                    assertThat(render.viewName()).isEqualTo("index");
                    assertThat(render.model()).containsExactly(
                            Map.entry("bookList", List.of("b1", "b2")),
                            Map.entry("bookCount", 2L));
                })
                .verifyComplete();
    }

    @Test
    void itemsMayContainNulls() {
        StepVerifier.create(helper.<String>combine(ResultProducer.just(Arrays.asList("b1", null)), ResultProducer.just(2)).toMono())
                .assertNext(result -> assertThat(result.items()).containsExactly("b1", null))
                .verifyComplete();
    }

    @Test
    void emptyCountCompletesEmpty() {
        StepVerifier.create(helper.<String>combine(ResultProducer.just(List.of("b1")), ResultProducer.<Long>empty()).toMono())
                .verifyComplete();
    }

    @Test
    void failedListFailsCombinationWithSameCause() {
        UpstreamFailure cause = new UpstreamFailure("list failed");
        AtomicInteger countCalls = new AtomicInteger();

        StepVerifier.create(helper.<String>combine(ResultProducer.<List<String>>error(cause),
                        ResultProducer.fromCallable(countCalls::incrementAndGet)).toMono())
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(cause))
                .verify();
    }

    @Test
    void lateListFailureWinsOverEmptyCount() {
        UpstreamFailure cause = new UpstreamFailure("list failed late");
        ResultProducer<List<String>> items = ResultProducer.fromMono(
                Mono.delay(Duration.ofMillis(50)).then(Mono.<List<String>>error(cause)));

        StepVerifier.create(helper.<String>combine(items, ResultProducer.<Long>empty()).toMono())
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(cause))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void combinedResultIsImmutable() {
        CombinedResult<String> result = new CombinedResult<>(List.of("a"), 1);

        assertThat(result.toModel("item")).containsOnlyKeys("itemList", "itemCount");
        assertThat(result.items()).isUnmodifiable();
    }
}
