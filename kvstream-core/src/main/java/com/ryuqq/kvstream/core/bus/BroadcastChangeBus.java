package com.ryuqq.kvstream.core.bus;

import com.ryuqq.kvstream.core.spi.ChangeBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Default in-process implementation of {@link ChangeBus}.
 *
 * <p>Publications are appended to a lock-free queue and drained by whichever
 * thread wins the work-in-progress counter. Every listener therefore observes
 * one global publish order, which implies FIFO per key per listener, even when
 * a listener publishes re-entrantly from inside its own callback.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Listeners:</strong> CopyOnWriteArrayList&lt;Listener&gt; - cheap iteration, rare mutation</li>
 *   <li><strong>Pending:</strong> ConcurrentLinkedQueue&lt;String&gt; - publications awaiting dispatch</li>
 *   <li><strong>Drain guard:</strong> AtomicInteger - only one thread dispatches at a time</li>
 * </ul>
 *
 * <p><strong>Delivery:</strong></p>
 * <ul>
 *   <li>Single-threaded callers see every listener invoked before {@code publish} returns</li>
 *   <li>When another thread is already draining, {@code publish} returns after enqueueing
 *       and the draining thread delivers the key</li>
 *   <li>Paused listeners are skipped; nothing is buffered for them</li>
 *   <li>A listener that throws is logged and does not affect the others</li>
 * </ul>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class BroadcastChangeBus implements ChangeBus {

    private static final Logger log = LoggerFactory.getLogger(BroadcastChangeBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile boolean closed;

    @Override
    public void publish(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (closed) {
            throw new IllegalStateException("ChangeBus is closed");
        }
        pending.offer(key);
        drain();
    }

    @Override
    public Registration listen(Consumer<String> onKey, Runnable onClose) {
        if (onKey == null) {
            throw new IllegalArgumentException("onKey cannot be null");
        }
        if (onClose == null) {
            throw new IllegalArgumentException("onClose cannot be null");
        }
        Listener listener = new Listener(onKey, onClose);
        if (closed) {
            listener.cancelled = true;
            listener.notifyClose();
            return listener;
        }
        listeners.add(listener);
        return listener;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("ChangeBus closed, completing {} listener(s)", listeners.size());
        for (Listener listener : listeners) {
            listener.cancelled = true;
            listeners.remove(listener);
            listener.notifyClose();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Number of currently registered listeners (paused ones included).
     *
     * @return listener count
     */
    public int listenerCount() {
        return listeners.size();
    }

    private void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            String key;
            while ((key = pending.poll()) != null) {
                dispatch(key);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void dispatch(String key) {
        log.debug("Dispatching change of '{}' to {} listener(s)", key, listeners.size());
        for (Listener listener : listeners) {
            if (listener.cancelled || listener.paused) {
                continue;
            }
            try {
                listener.onKey.accept(key);
            } catch (RuntimeException e) {
                log.error("Listener failed while handling change of '{}'", key, e);
            }
        }
    }

    private final class Listener implements Registration {

        private final Consumer<String> onKey;
        private final Runnable onClose;
        private volatile boolean paused;
        private volatile boolean cancelled;

        private Listener(Consumer<String> onKey, Runnable onClose) {
            this.onKey = onKey;
            this.onClose = onClose;
        }

        private void notifyClose() {
            try {
                onClose.run();
            } catch (RuntimeException e) {
                log.error("Listener failed while handling bus close", e);
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            listeners.remove(this);
        }

        @Override
        public void pause() {
            paused = true;
        }

        @Override
        public void resume() {
            paused = false;
        }

        @Override
        public boolean isPaused() {
            return paused;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
