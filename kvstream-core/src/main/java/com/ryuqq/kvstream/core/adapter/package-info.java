/**
 * 값 어댑터 패키지.
 *
 * <p>타입 값과 {@link com.ryuqq.kvstream.core.spi.KeyValueStore} 원시 표현 간의 변환을 담당합니다.</p>
 *
 * <h2>제공 어댑터</h2>
 * <ul>
 *   <li>원시 타입: {@link com.ryuqq.kvstream.core.adapter.BoolAdapter},
 *       {@link com.ryuqq.kvstream.core.adapter.IntAdapter},
 *       {@link com.ryuqq.kvstream.core.adapter.DoubleAdapter},
 *       {@link com.ryuqq.kvstream.core.adapter.StringAdapter},
 *       {@link com.ryuqq.kvstream.core.adapter.StringListAdapter}</li>
 *   <li>변환 타입: {@link com.ryuqq.kvstream.core.adapter.DateTimeAdapter},
 *       {@link com.ryuqq.kvstream.core.adapter.EnumAdapter}</li>
 *   <li>집계 뷰: {@link com.ryuqq.kvstream.core.adapter.KeySetAdapter} (읽기 전용)</li>
 * </ul>
 *
 * <p>JSON 어댑터는 kvstream-json-jackson 모듈에 있습니다.</p>
 *
 * @since 1.0.0
 * @author KvStream Team
 */
package com.ryuqq.kvstream.core.adapter;
