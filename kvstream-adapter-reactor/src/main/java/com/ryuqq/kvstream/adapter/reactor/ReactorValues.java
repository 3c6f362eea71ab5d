package com.ryuqq.kvstream.adapter.reactor;

import com.ryuqq.kvstream.core.observable.ObservableValue;
import com.ryuqq.kvstream.core.observable.Subscription;
import com.ryuqq.kvstream.core.observable.ValueObserver;
import com.ryuqq.kvstream.core.observable.ValueStream;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Reactor adapter over {@link ValueStream}.
 *
 * <p>Each Flux subscription opens its own {@link ValueStream} subscription, and cancelling the
 * Flux cancels it. Backpressure keeps only the latest value, which matches the "current state"
 * nature of the stream.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class ReactorValues {

    private ReactorValues() {
    }

    /**
     * Bridges a value stream into a Flux. A read error terminates the Flux.
     *
     * @param stream source stream
     * @return cold Flux
     */
    public static <T> Flux<T> toFlux(ValueStream<T> stream) {
        if (stream == null) {
            throw new IllegalArgumentException("stream cannot be null");
        }
        return Flux.create(sink -> bind(stream, sink, sink::error), FluxSink.OverflowStrategy.LATEST);
    }

    /**
     * Bridges a value stream into a Flux that survives read errors.
     *
     * @param stream source stream
     * @param onReadError receives errors instead of the Flux
     * @return cold Flux
     */
    public static <T> Flux<T> toFlux(ValueStream<T> stream, Consumer<? super Throwable> onReadError) {
        if (stream == null) {
            throw new IllegalArgumentException("stream cannot be null");
        }
        if (onReadError == null) {
            throw new IllegalArgumentException("onReadError cannot be null");
        }
        return Flux.create(sink -> bind(stream, sink, onReadError), FluxSink.OverflowStrategy.LATEST);
    }

    /**
     * Current value of an observable, read on subscription.
     *
     * @param value observable value
     * @return Mono of the current value
     */
    public static <T> Mono<T> currentValue(ObservableValue<T> value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return Mono.fromSupplier(value::currentValue);
    }

    private static <T> void bind(ValueStream<T> stream, FluxSink<T> sink, Consumer<? super Throwable> onError) {
        Subscription subscription = stream.subscribe(new ValueObserver<T>() {
            @Override
            public void onNext(T value) {
                sink.next(value);
            }

            @Override
            public void onError(Throwable error) {
                onError.accept(error);
            }

            @Override
            public void onComplete() {
                sink.complete();
            }
        });
        sink.onDispose(subscription::cancel);
    }
}
