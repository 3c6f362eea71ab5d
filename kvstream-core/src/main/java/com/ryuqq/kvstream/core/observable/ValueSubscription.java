package com.ryuqq.kvstream.core.observable;

import com.ryuqq.kvstream.core.spi.ChangeBus;

/**
 * One subscriber's pipeline on an {@link ObservableValue}.
 *
 * <p>Read-and-emit runs under a per-subscription lock, so an event arriving while the
 * initial value is being replayed waits and is then delivered with a fresh read.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
final class ValueSubscription<T> implements Subscription {

    private final ObservableValue<T> source;
    private final ValueObserver<? super T> observer;
    private final Object lock = new Object();

    private volatile ChangeBus.Registration registration;
    private volatile boolean cancelled;
    private boolean started;
    private boolean closeRequested;
    private boolean completed;

    ValueSubscription(ObservableValue<T> source, ValueObserver<? super T> observer) {
        this.source = source;
        this.observer = observer;
    }

    void start() {
        synchronized (lock) {
            // listen before reading so no change between the read and the attach is lost
            registration = source.changeBus().listen(this::onKey, this::onBusClosed);
            try {
                observer.onNext(source.currentValue());
            } catch (RuntimeException e) {
                cancelled = true;
                registration.cancel();
                throw e;
            }
            started = true;
            if (closeRequested) {
                complete();
            }
        }
    }

    private void onKey(String changedKey) {
        String key = source.key();
        if (key != null && !key.equals(changedKey)) {
            return;
        }
        synchronized (lock) {
            if (cancelled || completed) {
                return;
            }
            T value;
            try {
                value = source.currentValue();
            } catch (RuntimeException e) {
                observer.onError(e);
                return;
            }
            observer.onNext(value);
        }
    }

    private void onBusClosed() {
        synchronized (lock) {
            if (cancelled || completed) {
                return;
            }
            if (!started) {
                closeRequested = true;
                return;
            }
            complete();
        }
    }

    private void complete() {
        completed = true;
        observer.onComplete();
    }

    /**
     * Detaches from the bus without waiting for the subscription lock.
     *
     * <p>Called on the emitting thread (from inside a callback) no further value is delivered.
     * From another thread, one emission whose read already started may still arrive after this
     * returns. Owners such as the combinator call this while holding their own lock, so it must
     * never block on the subscription lock.</p>
     */
    @Override
    public void cancel() {
        cancelled = true;
        ChangeBus.Registration current = registration;
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public void pause() {
        registration.pause();
    }

    @Override
    public void resume() {
        registration.resume();
    }

    @Override
    public boolean isPaused() {
        return registration.isPaused();
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
