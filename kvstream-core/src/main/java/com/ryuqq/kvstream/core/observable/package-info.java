/**
 * 관찰 가능한 값 패키지.
 *
 * <p>{@link com.ryuqq.kvstream.core.observable.ObservableValue}가 핵심 원시 타입이며,
 * {@link com.ryuqq.kvstream.core.observable.DistinctValueStream}이 구독별 중복 제거를 제공합니다.
 * 소비자는 {@link com.ryuqq.kvstream.core.observable.ValueStream}과
 * {@link com.ryuqq.kvstream.core.observable.Subscription}만 알면 됩니다.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.core.observable;
