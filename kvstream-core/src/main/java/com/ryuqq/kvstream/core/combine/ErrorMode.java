package com.ryuqq.kvstream.core.combine;

/**
 * Combinator 오류 처리 방식.
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public enum ErrorMode {

    /**
     * 입력 하나에서 오류 발생 시 모든 구독을 취소하고 오류를 한 번 전달 (종료 신호).
     */
    CANCEL_ALL,

    /**
     * 실패한 입력의 오류만 전달하고 나머지 입력은 계속 동작.
     */
    CONTINUE
}
