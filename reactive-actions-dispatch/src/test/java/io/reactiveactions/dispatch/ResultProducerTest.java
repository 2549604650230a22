package io.reactiveactions.dispatch;

import io.reactiveactions.core.Errors;
import io.reactiveactions.core.ReactiveActionsException.ActionTimeout;
import io.reactiveactions.core.ReactiveActionsException.AlreadyConsumed;
import io.reactiveactions.core.ReactiveActionsException.EmptyResult;
import io.reactiveactions.core.ReactiveActionsException.UpstreamFailure;
import io.reactiveactions.core.ReactiveActionsException.ValidationFailure;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ResultProducerTest {

    @Test
    void mapTransformsValue() {
        StepVerifier.create(ResultProducer.just(21).map(v -> v * 2).toMono())
                .expectNext(42)
                .verifyComplete();
    }

    @Test
    void mapReturningNullCompletesEmpty() {
        StepVerifier.create(ResultProducer.just("x").map(v -> null).toMono())
                .verifyComplete();
    }

    @Test
    void mapIsNotInvokedOnEmptyOrFailure() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.create(ResultProducer.<String>empty().map(v -> calls.incrementAndGet()).toMono())
                .verifyComplete();
        StepVerifier.create(ResultProducer.<String>error(new IllegalStateException("boom"))
                        .map(v -> calls.incrementAndGet()).toMono())
                .verifyErrorMessage("boom");

        assertThat(calls).hasValue(0);
    }

    @Test
    void switchMapChainsProducers() {
        ResultProducer<String> chained = ResultProducer.just("42")
                .switchMap(id -> ResultProducer.just("book-" + id));

        StepVerifier.create(chained.toMono()).expectNext("book-42").verifyComplete();
    }

    @Test
    void switchMapPropagatesInnerFailure() {
        ResultProducer<String> chained = ResultProducer.just("42")
                .switchMap(id -> ResultProducer.<String>error(new UpstreamFailure("db down")));

        StepVerifier.create(chained.toMono())
                .expectError(UpstreamFailure.class)
                .verify();
    }

    @Test
    void switchMapReturningNullFails() {
        StepVerifier.create(ResultProducer.just(1).switchMap(v -> null).toMono())
                .expectError(NullPointerException.class)
                .verify();
    }

    @Test
    void switchIfEmptyNeverSubscribesFallbackWhenUpstreamEmits() {
        AtomicInteger fallbackCalls = new AtomicInteger();
        ResultProducer<String> fallback = ResultProducer.fromCallable(() -> {
            fallbackCalls.incrementAndGet();
            return "fallback";
        });

        StepVerifier.create(ResultProducer.just("value").switchIfEmpty(fallback).toMono())
                .expectNext("value")
                .verifyComplete();
        assertThat(fallbackCalls).hasValue(0);

        StepVerifier.create(ResultProducer.<String>empty().switchIfEmpty(fallback).toMono())
                .expectNext("fallback")
                .verifyComplete();
        assertThat(fallbackCalls).hasValue(1);
    }

    @Test
    void defaultIfEmptySuppliesValue() {
        StepVerifier.create(ResultProducer.<String>empty().defaultIfEmpty("none").toMono())
                .expectNext("none")
                .verifyComplete();
    }

    @Test
    void onErrorReturnRecoversAnyFailure() {
        ResultProducer<String> recovered = ResultProducer.<String>error(new IllegalStateException("boom"))
                .onErrorReturn(e -> "recovered: " + e.getMessage());

        StepVerifier.create(recovered.toMono()).expectNext("recovered: boom").verifyComplete();
    }

    @Test
    void typedOnErrorReturnOnlyRecoversMatchingFailures() {
        Errors errors = Errors.builder("book").rejectValue("title", "blank").build();

        ResultProducer<String> validation = ResultProducer.<String>error(new ValidationFailure(errors))
                .onErrorReturn(ValidationFailure.class, e -> "invalid " + e.errors().objectName());
        StepVerifier.create(validation.toMono()).expectNext("invalid book").verifyComplete();

        ResultProducer<String> other = ResultProducer.<String>error(new IllegalStateException("boom"))
                .onErrorReturn(ValidationFailure.class, e -> "invalid");
        StepVerifier.create(other.toMono()).expectError(IllegalStateException.class).verify();
    }

    @Test
    void zipCombinesBothValuesOnce() {
        AtomicInteger combinerCalls = new AtomicInteger();

        ResultProducer<String> zipped = ResultProducer.zip(ResultProducer.just("a"), ResultProducer.just(2), (a, b) -> {
            combinerCalls.incrementAndGet();
            return a + b;
        });

        StepVerifier.create(zipped.toMono()).expectNext("a2").verifyComplete();
        assertThat(combinerCalls).hasValue(1);
    }

    @Test
    void zipCompletesEmptyWhenEitherInputIsEmpty() {
        AtomicInteger combinerCalls = new AtomicInteger();

        ResultProducer<String> zipped = ResultProducer.zip(ResultProducer.just("a"), ResultProducer.<Integer>empty(), (a, b) -> {
            combinerCalls.incrementAndGet();
            return a + b;
        });

        StepVerifier.create(zipped.toMono()).verifyComplete();
        assertThat(combinerCalls).hasValue(0);
    }

    @Test
    void zipFailsWithFirstFailure() {
        UpstreamFailure cause = new UpstreamFailure("list failed");
        ResultProducer<Long> slowCount = ResultProducer.fromMono(Mono.delay(Duration.ofMillis(200)).map(t -> 2L));

        ResultProducer<String> zipped = ResultProducer.zip(ResultProducer.<List<String>>error(cause), slowCount,
                (list, count) -> list.size() + "/" + count);

        StepVerifier.create(zipped.toMono())
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(cause))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void zipFailureWinsOverEmptyInput() {
        UpstreamFailure cause = new UpstreamFailure("list failed late");
        ResultProducer<String> lateFailure = ResultProducer.fromMono(
                Mono.delay(Duration.ofMillis(50)).then(Mono.<String>error(cause)));
        AtomicInteger combinerCalls = new AtomicInteger();

        ResultProducer<String> zipped = ResultProducer.zip(lateFailure, ResultProducer.<Integer>empty(), (a, b) -> {
            combinerCalls.incrementAndGet();
            return a + b;
        });

        StepVerifier.create(zipped.toMono())
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(cause))
                .verify(Duration.ofSeconds(5));
        assertThat(combinerCalls).hasValue(0);
    }

    @Test
    void zipCombinerReturningNullFails() {
        StepVerifier.create(ResultProducer.zip(ResultProducer.just("a"), ResultProducer.just(1), (a, b) -> (String) null).toMono())
                .expectError(NullPointerException.class)
                .verify();
    }

    @Test
    void requireValueTurnsEmptyIntoFailure() {
        StepVerifier.create(ResultProducer.<String>empty().requireValue().toMono())
                .expectError(EmptyResult.class)
                .verify();
    }

    @Test
    void timeoutFailsWithActionTimeout() {
        ResultProducer<Long> never = ResultProducer.fromMono(Mono.<Long>never()).timeout(Duration.ofMillis(50));

        StepVerifier.create(never.toMono())
                .expectErrorSatisfies(e -> assertThat(e).isInstanceOfSatisfying(ActionTimeout.class,
                        timeout -> assertThat(timeout.timeout()).isEqualTo(Duration.ofMillis(50))))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void restartableProducerRunsIndependentlyPerSubscription() {
        AtomicInteger invocations = new AtomicInteger();
        ResultProducer<Integer> producer = ResultProducer.fromCallable(invocations::incrementAndGet);

        StepVerifier.create(producer.toMono()).expectNext(1).verifyComplete();
        StepVerifier.create(producer.toMono()).expectNext(2).verifyComplete();
    }

    @Test
    void restartableFutureSupplierIsCalledPerSubscription() {
        AtomicInteger invocations = new AtomicInteger();
        ResultProducer<Integer> producer = ResultProducer.fromFuture(
                () -> CompletableFuture.completedFuture(invocations.incrementAndGet()));

        StepVerifier.create(producer.toMono()).expectNext(1).verifyComplete();
        StepVerifier.create(producer.toMono()).expectNext(2).verifyComplete();
    }

    @Test
    void runningFutureIsOneShot() {
        ResultProducer<String> producer = ResultProducer.fromFuture(CompletableFuture.completedFuture("once"));

        StepVerifier.create(producer.toMono()).expectNext("once").verifyComplete();
        StepVerifier.create(producer.toMono()).expectError(AlreadyConsumed.class).verify();
    }

    @Test
    void oneShotFailsSecondSubscription() {
        ResultProducer<String> producer = ResultProducer.just("x").oneShot();

        StepVerifier.create(producer.toMono()).expectNext("x").verifyComplete();
        StepVerifier.create(producer.toMono()).expectError(AlreadyConsumed.class).verify();
    }

    @Test
    void fromOptionalEmitsContentOrCompletesEmpty() {
        StepVerifier.create(ResultProducer.fromOptional(() -> Optional.of("x")).toMono()).expectNext("x").verifyComplete();
        StepVerifier.create(ResultProducer.fromOptional(Optional::<String>empty).toMono()).verifyComplete();
    }

    @Test
    void fromPublisherRejectsMoreThanOneElement() {
        StepVerifier.create(ResultProducer.fromPublisher(Flux.just(1)).toMono()).expectNext(1).verifyComplete();
        StepVerifier.create(ResultProducer.fromPublisher(Flux.just(1, 2)).toMono())
                .expectError(IndexOutOfBoundsException.class)
                .verify();
    }

    @Test
    void fromFlowPublisherEmitsSingleElement() {
        SubmissionPublisher<String> publisher = new SubmissionPublisher<>();
        ResultProducer<String> producer = ResultProducer.fromFlowPublisher(publisher);

        StepVerifier.create(producer.toMono())
                .then(() -> {
                    publisher.submit("flow");
                    publisher.close();
                })
                .expectNext("flow")
                .verifyComplete();
    }

    @Test
    void subscriptionDeliversExactlyOneTerminalEvent() {
        AtomicReference<String> value = new AtomicReference<>();
        AtomicInteger events = new AtomicInteger();

        ProducerSubscription subscription = ResultProducer.just("v").subscribe(new ResultObserver<>() {
            @Override
            public void onValue(String v) {
                value.set(v);
                events.incrementAndGet();
            }

            @Override
            public void onEmpty() {
                events.incrementAndGet();
            }

            @Override
            public void onError(Throwable error) {
                events.incrementAndGet();
            }
        });

        assertThat(value).hasValue("v");
        assertThat(events).hasValue(1);
        assertThat(subscription.state()).isEqualTo(ProducerState.TERMINATED);
        assertThat(subscription.cancel()).isFalse();
        assertThat(subscription.state()).isEqualTo(ProducerState.TERMINATED);
    }

    @Test
    void cancelledSubscriptionIgnoresLateValue() {
        CompletableFuture<String> future = new CompletableFuture<>();
        AtomicInteger events = new AtomicInteger();

        ProducerSubscription subscription = ResultProducer.fromFuture(future).subscribe(new ResultObserver<>() {
            @Override
            public void onValue(String v) {
                events.incrementAndGet();
            }

            @Override
            public void onEmpty() {
                events.incrementAndGet();
            }

            @Override
            public void onError(Throwable error) {
                events.incrementAndGet();
            }
        });
        assertThat(subscription.state()).isEqualTo(ProducerState.ACTIVE);

        assertThat(subscription.cancel()).isTrue();
        future.complete("late");

        assertThat(subscription.state()).isEqualTo(ProducerState.CANCELLED);
        assertThat(events).hasValue(0);
    }
}
