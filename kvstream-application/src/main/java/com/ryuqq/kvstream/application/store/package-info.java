/**
 * 호출자용 스트리밍 저장소 façade 패키지.
 *
 * <p>{@link com.ryuqq.kvstream.application.store.StreamingKeyValueStore}는 타입별 getter/setter,
 * 키 목록 집계 뷰, remove, clear를 제공합니다.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.application.store;
