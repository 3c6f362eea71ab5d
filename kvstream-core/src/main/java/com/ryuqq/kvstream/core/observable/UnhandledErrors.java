package com.ryuqq.kvstream.core.observable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * onError를 구현하지 않은 수신자의 오류 보고.
 *
 * @author KvStream Team
 * @since 1.0.0
 */
final class UnhandledErrors {

    private static final Logger log = LoggerFactory.getLogger(UnhandledErrors.class);

    private UnhandledErrors() {
    }

    static void report(Object observer, Throwable error) {
        log.error("Unhandled error delivered to {}", observer, error);
    }
}
