package com.ryuqq.kvstream.core.combine;

/**
 * Combinator 설정 (불변 record).
 *
 * @author KvStream Team
 * @since 1.0.0
 * @param errorMode 오류 처리 방식 (기본 {@link ErrorMode#CANCEL_ALL})
 */
public record CombinatorConfig(ErrorMode errorMode) {

    /**
     * 기본 설정 생성자 (CANCEL_ALL).
     */
    public CombinatorConfig() {
        this(ErrorMode.CANCEL_ALL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException errorMode가 null인 경우
     */
    public CombinatorConfig {
        if (errorMode == null) {
            throw new IllegalArgumentException("errorMode cannot be null");
        }
    }

    /**
     * errorMode만 변경한 새 인스턴스 생성.
     */
    public CombinatorConfig withErrorMode(ErrorMode errorMode) {
        return new CombinatorConfig(errorMode);
    }
}
