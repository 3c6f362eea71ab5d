/**
 * 전역 세션 패키지.
 *
 * <p>{@link com.ryuqq.kvstream.application.session.StreamingKeyValueStores}가 하나의 저장소 세션을
 * 지연 초기화하고 메모이즈합니다.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.application.session;
