package com.ryuqq.kvstream.core.observable;

/**
 * 구독 핸들.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>cancel: 이 구독에만 전달 중단 (저장소 및 다른 구독자에 영향 없음), 멱등</li>
 *   <li>pause: 일시정지 중 발행된 변경은 버려짐 (큐잉 없음)</li>
 *   <li>resume: 이후 발행되는 변경부터 다시 관찰</li>
 * </ul>
 *
 * <p>값을 다시 읽어 전달하는 "현재 상태" 알림이므로, 일시정지 중 놓친 변경이 있어도
 * 다음 전달 값은 항상 최신입니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public interface Subscription {

    /**
     * 구독 취소.
     *
     * <p>콜백 안(전달 스레드)에서 호출하면 이후 값은 전달되지 않습니다. 다른 스레드에서 호출하면
     * 이미 읽기를 시작한 전달 한 건이 반환 후에 도착할 수 있습니다.</p>
     */
    void cancel();

    /**
     * 일시정지.
     */
    void pause();

    /**
     * 재개.
     */
    void resume();

    /**
     * 일시정지 여부.
     *
     * @return 일시정지 상태이면 true
     */
    boolean isPaused();

    /**
     * 취소 여부.
     *
     * @return 취소되었으면 true
     */
    boolean isCancelled();
}
