/**
 * 구독 빈도 진단 패키지.
 *
 * <p>{@link com.ryuqq.kvstream.core.guard.RateGuard}는 같은 키에 대한 구독이
 * 짧은 시간에 반복되는 패턴을 감지하여 {@link com.ryuqq.kvstream.core.guard.RateGuardListener}로
 * 보고합니다. 데이터 흐름에는 영향을 주지 않습니다.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.core.guard;
