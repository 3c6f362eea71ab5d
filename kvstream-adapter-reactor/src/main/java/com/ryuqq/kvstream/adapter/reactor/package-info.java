/**
 * Project Reactor bridge for value streams.
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.adapter.reactor;
