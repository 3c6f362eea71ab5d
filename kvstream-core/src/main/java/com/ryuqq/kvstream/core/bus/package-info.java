/**
 * Change bus package.
 *
 * <p>{@link com.ryuqq.kvstream.core.bus.BroadcastChangeBus} is the default
 * {@link com.ryuqq.kvstream.core.spi.ChangeBus}: one instance per store session.
 * {@link com.ryuqq.kvstream.core.bus.WriteNotifications} ties store write completion to
 * publication.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.core.bus;
