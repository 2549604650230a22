package io.reactiveactions.rxjava3;

import io.reactiveactions.dispatch.ResultProducer;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;

import java.util.Objects;

/**
 * RxJava 3 adapters for {@link ResultProducer}.
 *
 * <p>Every adapter subscribes to the Rx source once per producer subscription, so the resulting
 * producers are as restartable as the source. Rx errors propagate unchanged.
 */
public final class RxProducers {

    private RxProducers() {
    }

    public static <T> ResultProducer<T> fromSingle(Single<? extends T> single) {
        Objects.requireNonNull(single, "single");
        return ResultProducer.fromPublisher(single.toFlowable());
    }

    public static <T> ResultProducer<T> fromMaybe(Maybe<? extends T> maybe) {
        Objects.requireNonNull(maybe, "maybe");
        return ResultProducer.fromPublisher(maybe.toFlowable());
    }

    /**
     * Emits the only element of {@code observable}, or completes empty. A second element fails
     * the producer with {@link IllegalArgumentException}.
     */
    public static <T> ResultProducer<T> fromObservable(Observable<? extends T> observable) {
        Objects.requireNonNull(observable, "observable");
        return fromMaybe(observable.singleElement());
    }

    /**
     * {@link Flowable} counterpart of {@link #fromObservable(Observable)}.
     */
    public static <T> ResultProducer<T> fromFlowable(Flowable<? extends T> flowable) {
        Objects.requireNonNull(flowable, "flowable");
        return fromMaybe(flowable.singleElement());
    }

    /** Completes empty when {@code completable} completes. */
    public static <T> ResultProducer<T> fromCompletable(Completable completable) {
        Objects.requireNonNull(completable, "completable");
        return ResultProducer.fromPublisher(completable.<T>toFlowable());
    }

    /** Exposes a producer as a {@link Maybe}, subscribing to it on every Rx subscription. */
    public static <T> Maybe<T> toMaybe(ResultProducer<T> producer) {
        Objects.requireNonNull(producer, "producer");
        return Maybe.fromPublisher(producer.toMono());
    }
}
