/**
 * Jackson-backed JSON value adapter.
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.json.jackson;
