package io.reactiveactions.dispatch;

import io.reactiveactions.core.ReactiveActionsException.ActionTimeout;
import io.reactiveactions.core.ReactiveActionsException.AlreadyConsumed;
import io.reactiveactions.core.ReactiveActionsException.EmptyResult;
import org.reactivestreams.FlowAdapters;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A value that becomes available asynchronously: zero or one value of type {@code T}, or a failure.
 *
 * <p>Producers are lazy. Nothing runs until {@link #subscribe(ResultObserver)} is called, and
 * composition operators only describe further stages. A producer is restartable unless stated
 * otherwise: every subscription runs an independent instance of the chain. One-shot producers
 * (see {@link #oneShot()}) fail any subscription after the first with {@link AlreadyConsumed}.
 *
 * <p>Operator semantics are those of Project Reactor's {@link Mono}, which backs every producer:
 * <pre>{@code
 * ResultProducer<ResponseAction> show = books.findById(ctx.param("id").orElseThrow())
 *     .map(book -> actions.respond(book))
 *     .switchIfEmpty(ResultProducer.just(actions.notFound()));
 * }</pre>
 *
 * @param <T> type of the value
 */
public final class ResultProducer<T> {

    private final Mono<T> source;

    private ResultProducer(Mono<T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    // ===== Factories =====

    public static <T> ResultProducer<T> just(T value) {
        return new ResultProducer<>(Mono.just(Objects.requireNonNull(value, "value")));
    }

    /** Emits {@code value}, or completes empty when it is null. */
    public static <T> ResultProducer<T> justOrEmpty(T value) {
        return new ResultProducer<>(Mono.justOrEmpty(value));
    }

    public static <T> ResultProducer<T> empty() {
        return new ResultProducer<>(Mono.empty());
    }

    public static <T> ResultProducer<T> error(Throwable error) {
        return new ResultProducer<>(Mono.error(Objects.requireNonNull(error, "error")));
    }

    /**
     * Invokes {@code callable} on every subscription. A null result completes empty; a thrown
     * exception becomes the failure.
     */
    public static <T> ResultProducer<T> fromCallable(Callable<? extends T> callable) {
        Objects.requireNonNull(callable, "callable");
        return new ResultProducer<>(Mono.fromCallable(callable));
    }

    /** Invokes {@code supplier} on every subscription and emits the optional's content, if any. */
    public static <T> ResultProducer<T> fromOptional(Supplier<Optional<T>> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return new ResultProducer<T>(Mono.defer(() -> Mono.<T>justOrEmpty(supplier.get())));
    }

    /**
     * Restartable producer over a future-returning operation: {@code futureSupplier} is called once
     * per subscription. A null completion value completes empty.
     */
    public static <T> ResultProducer<T> fromFuture(Supplier<? extends CompletionStage<? extends T>> futureSupplier) {
        Objects.requireNonNull(futureSupplier, "futureSupplier");
        return new ResultProducer<T>(Mono.defer(() -> Mono.fromCompletionStage(futureSupplier.get())));
    }

    /**
     * One-shot producer over an already running stage. A second subscription fails with
     * {@link AlreadyConsumed}.
     */
    public static <T> ResultProducer<T> fromFuture(CompletionStage<? extends T> stage) {
        Objects.requireNonNull(stage, "stage");
        return new ResultProducer<T>(Mono.fromCompletionStage(stage)).oneShot();
    }

    /**
     * Producer over a Reactive Streams publisher that must emit at most one element; a second
     * element fails the producer with {@link IndexOutOfBoundsException}.
     */
    public static <T> ResultProducer<T> fromPublisher(Publisher<? extends T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return new ResultProducer<T>(Flux.<T>from(publisher).singleOrEmpty());
    }

    /** {@link Flow.Publisher} counterpart of {@link #fromPublisher(Publisher)}. */
    public static <T> ResultProducer<T> fromFlowPublisher(Flow.Publisher<? extends T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return fromPublisher(FlowAdapters.toPublisher(publisher));
    }

    public static <T> ResultProducer<T> fromMono(Mono<? extends T> mono) {
        Objects.requireNonNull(mono, "mono");
        return new ResultProducer<T>(Mono.from(mono));
    }

    /**
     * Waits for both producers to terminate, then combines their values.
     *
     * <p>Both inputs are subscribed together. The first failure wins and cancels the other input,
     * even when the other input already completed empty. Without a failure, the result completes
     * empty if either input is empty. The combiner runs exactly once, and only when both produced
     * a value; returning null from it is a failure.
     */
    public static <A, B, C> ResultProducer<C> zip(ResultProducer<? extends A> a,
                                                  ResultProducer<? extends B> b,
                                                  BiFunction<? super A, ? super B, ? extends C> combiner) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        Objects.requireNonNull(combiner, "combiner");
        // empty inputs become Optional.empty() so only a failure can end the zip early
        Mono<Optional<A>> left = Mono.<A>from(a.source).map(Optional::of).defaultIfEmpty(Optional.empty());
        Mono<Optional<B>> right = Mono.<B>from(b.source).map(Optional::of).defaultIfEmpty(Optional.empty());
        return new ResultProducer<C>(Mono.zip(left, right).flatMap(pair -> {
            if (pair.getT1().isEmpty() || pair.getT2().isEmpty()) {
                return Mono.<C>empty();
            }
            C combined = combiner.apply(pair.getT1().get(), pair.getT2().get());
            if (combined == null) {
                return Mono.<C>error(new NullPointerException("zip combiner returned null"));
            }
            return Mono.just(combined);
        }));
    }

    // ===== Composition =====

    /**
     * Transforms the value if present; empty and failure pass through. A null result from
     * {@code mapper} completes empty.
     */
    public <R> ResultProducer<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return new ResultProducer<>(source.<R>handle((value, sink) -> {
            R mapped = mapper.apply(value);
            if (mapped != null) {
                sink.next(mapped);
            }
        }));
    }

    /**
     * On a value, continues with the producer returned by {@code mapper}. Failures from either
     * stage propagate; an empty upstream never invokes {@code mapper}.
     */
    public <R> ResultProducer<R> switchMap(Function<? super T, ? extends ResultProducer<? extends R>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return new ResultProducer<>(source.<R>flatMap(value -> {
            ResultProducer<? extends R> next = mapper.apply(value);
            if (next == null) {
                return Mono.error(new NullPointerException("switchMap mapper returned null"));
            }
            return next.source;
        }));
    }

    /**
     * Continues with {@code fallback} when this producer completes empty. The fallback is never
     * subscribed if a value is emitted.
     */
    public ResultProducer<T> switchIfEmpty(ResultProducer<? extends T> fallback) {
        Objects.requireNonNull(fallback, "fallback");
        return new ResultProducer<>(source.switchIfEmpty(fallback.source));
    }

    public ResultProducer<T> defaultIfEmpty(T value) {
        return new ResultProducer<>(source.defaultIfEmpty(Objects.requireNonNull(value, "value")));
    }

    /**
     * Replaces any failure with the value computed by {@code handler}. A null substitute
     * completes empty.
     */
    public ResultProducer<T> onErrorReturn(Function<? super Throwable, ? extends T> handler) {
        Objects.requireNonNull(handler, "handler");
        return new ResultProducer<>(source.onErrorResume(e -> Mono.<T>justOrEmpty(handler.apply(e))));
    }

    /**
     * Replaces failures of the given type only; other failures propagate.
     */
    public <E extends Throwable> ResultProducer<T> onErrorReturn(Class<E> type, Function<? super E, ? extends T> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        return new ResultProducer<>(source.onErrorResume(type, e -> Mono.<T>justOrEmpty(handler.apply(e))));
    }

    /** Turns an empty completion into an {@link EmptyResult} failure. */
    public ResultProducer<T> requireValue() {
        return new ResultProducer<>(source.switchIfEmpty(Mono.<T>error(() -> new EmptyResult("Producer completed without a value"))));
    }

    /**
     * Fails with {@link ActionTimeout} when no terminal event arrives within {@code timeout}.
     */
    public ResultProducer<T> timeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new ResultProducer<>(source.timeout(timeout, Mono.<T>error(() -> new ActionTimeout(timeout))));
    }

    /** Subscribes (and so runs the whole chain) on the given scheduler. */
    public ResultProducer<T> subscribeOn(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        return new ResultProducer<>(source.subscribeOn(scheduler));
    }

    /**
     * Returns a non-restartable view of this producer: the first subscription runs the chain,
     * later ones fail with {@link AlreadyConsumed}.
     */
    public ResultProducer<T> oneShot() {
        AtomicBoolean consumed = new AtomicBoolean();
        return new ResultProducer<>(Mono.defer(() -> consumed.compareAndSet(false, true)
                ? source
                : Mono.<T>error(new AlreadyConsumed("Producer has already been subscribed"))));
    }

    // ===== Termination =====

    public ProducerSubscription subscribe(ResultObserver<? super T> observer) {
        return ProducerSubscription.start(source, observer);
    }

    /** Exposes the backing {@link Mono} for interop with Reactor-based code. */
    public Mono<T> toMono() {
        return source;
    }
}
