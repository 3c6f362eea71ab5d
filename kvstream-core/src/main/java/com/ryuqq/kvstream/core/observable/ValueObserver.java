package com.ryuqq.kvstream.core.observable;

/**
 * 값 스트림 수신자.
 *
 * <p>{@link #onNext(Object)}만 구현하면 람다로 사용할 수 있습니다.
 * 오류를 처리하지 않는 수신자의 오류는 error 로그로 남습니다.</p>
 *
 * <p><strong>신호 규칙:</strong></p>
 * <ul>
 *   <li>onNext: 0회 이상</li>
 *   <li>onError: 스트림에 따라 종료 신호일 수도, 아닐 수도 있음
 *       ({@code ObservableValue}는 읽기 실패 후에도 계속 변경을 전달)</li>
 *   <li>onComplete: 최대 1회, 이후 신호 없음</li>
 * </ul>
 *
 * @param <T> 값 타입
 * @author KvStream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueObserver<T> {

    /**
     * 새 값 수신.
     *
     * @param value 값 (non-null)
     */
    void onNext(T value);

    /**
     * 오류 수신.
     *
     * @param error 오류
     */
    default void onError(Throwable error) {
        UnhandledErrors.report(this, error);
    }

    /**
     * 완료 수신.
     */
    default void onComplete() {
    }
}
