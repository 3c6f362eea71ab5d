/**
 * 여러 ObservableValue를 하나의 combine-latest 스냅샷 스트림으로 결합하는 패키지.
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.core.combine;
