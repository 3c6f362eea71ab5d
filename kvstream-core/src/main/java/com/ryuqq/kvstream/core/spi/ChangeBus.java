package com.ryuqq.kvstream.core.spi;

import java.util.function.Consumer;

/**
 * Change Notification SPI: a broadcast channel of changed keys.
 *
 * <p>Exactly one bus exists per store session. Every write that completes
 * successfully publishes its key here, and every active listener observes every
 * publication independently.</p>
 *
 * <p><strong>Delivery Guarantees:</strong></p>
 * <ul>
 *   <li>Push-based, synchronous fan-out to the listeners registered at publish time</li>
 *   <li>Publications for the same key reach a given listener in publish order</li>
 *   <li>Paused listeners do not receive events; events are not queued for them</li>
 *   <li>No replay: a listener registered after a publication never sees it</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish and listen may be called from any thread</li>
 *   <li>Isolation: a listener that throws must not prevent delivery to the others</li>
 * </ul>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public interface ChangeBus {

    /**
     * Broadcasts a changed key to every active listener.
     *
     * @param key the changed key
     * @throws IllegalArgumentException if key is null
     * @throws IllegalStateException if the bus is closed
     */
    void publish(String key);

    /**
     * Registers a listener for every future publication.
     *
     * @param onKey invoked with each published key
     * @param onClose invoked once when the bus closes
     * @return the registration handle
     * @throws IllegalArgumentException if any callback is null
     */
    Registration listen(Consumer<String> onKey, Runnable onClose);

    /**
     * Closes the bus: notifies every listener through its close callback and
     * rejects further publications.
     */
    void close();

    /**
     * Reports whether {@link #close()} has been called.
     *
     * @return true if closed
     */
    boolean isClosed();

    /**
     * A single listener attachment to the bus.
     *
     * @author KvStream Team
     * @since 1.0.0
     */
    interface Registration {

        /**
         * Stops delivery to this listener. Idempotent.
         */
        void cancel();

        /**
         * Suspends delivery; publications while paused are dropped.
         */
        void pause();

        /**
         * Resumes delivery of future publications.
         */
        void resume();

        /**
         * Reports whether delivery is currently suspended.
         *
         * @return true if paused
         */
        boolean isPaused();

        /**
         * Reports whether this registration was cancelled.
         *
         * @return true if cancelled
         */
        boolean isCancelled();
    }
}
