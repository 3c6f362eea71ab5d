package com.ryuqq.kvstream.core.combine;

/**
 * 세 입력 결합 함수.
 *
 * @param <A> 첫 번째 입력 타입
 * @param <B> 두 번째 입력 타입
 * @param <C> 세 번째 입력 타입
 * @param <R> 결과 타입
 *
 * @author KvStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TriFunction<A, B, C, R> {

    R apply(A a, B b, C c);
}
