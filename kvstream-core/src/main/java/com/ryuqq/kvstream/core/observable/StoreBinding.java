package com.ryuqq.kvstream.core.observable;

import com.ryuqq.kvstream.core.guard.RateGuard;
import com.ryuqq.kvstream.core.spi.ChangeBus;
import com.ryuqq.kvstream.core.spi.KeyValueStore;

/**
 * 하나의 저장소 세션을 구성하는 협력 객체 묶음.
 *
 * <p>세션당 하나의 {@link ChangeBus}를 공유하며, 같은 바인딩으로 만든
 * 모든 {@link ObservableValue}가 서로의 쓰기를 관찰합니다.</p>
 *
 * @param store 백엔드 저장소
 * @param changeBus 변경 브로드캐스트 버스
 * @param rateGuard 재구독 진단기
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public record StoreBinding(
    KeyValueStore store,
    ChangeBus changeBus,
    RateGuard rateGuard
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StoreBinding {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (changeBus == null) {
            throw new IllegalArgumentException("changeBus cannot be null");
        }
        if (rateGuard == null) {
            throw new IllegalArgumentException("rateGuard cannot be null");
        }
    }
}
