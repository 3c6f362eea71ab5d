package com.ryuqq.kvstream.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate Guard 진단 수신자 (사이드 채널).
 *
 * <p>구독 데이터 흐름과 분리되어 있으며, 진단은 구독을 막거나 실패시키지 않습니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RateGuardListener {

    /**
     * 위반 감지 시 호출.
     *
     * @param violation 진단 정보
     */
    void onViolation(RateGuardViolation violation);

    /**
     * SLF4J warn 로그로 보고하는 기본 수신자.
     *
     * @return 로깅 수신자
     */
    static RateGuardListener logging() {
        Logger log = LoggerFactory.getLogger(RateGuard.class);
        return violation -> log.warn(violation.message());
    }
}
