package com.ryuqq.kvstream.core.observable;

/**
 * 구독 가능한 값 스트림.
 *
 * <p>소비자 측 최소 계약입니다. 구독할 때마다 독립적인 파이프라인이 생성되며,
 * 반환된 {@link Subscription}으로 일시정지/재개/취소를 제어합니다.</p>
 *
 * @param <T> 값 타입
 * @author KvStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueStream<T> {

    /**
     * 구독 시작.
     *
     * @param observer 값 수신자
     * @return 구독 핸들
     * @throws IllegalArgumentException observer가 null인 경우
     */
    Subscription subscribe(ValueObserver<? super T> observer);
}
