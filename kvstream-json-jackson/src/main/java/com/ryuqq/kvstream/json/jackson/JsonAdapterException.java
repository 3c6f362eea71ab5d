package com.ryuqq.kvstream.json.jackson;

/**
 * Raised when a value cannot be converted to or from its stored JSON form.
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public class JsonAdapterException extends RuntimeException {

    public JsonAdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
