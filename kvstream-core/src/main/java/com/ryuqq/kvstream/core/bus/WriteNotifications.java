package com.ryuqq.kvstream.core.bus;

import com.ryuqq.kvstream.core.spi.ChangeBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 쓰기 완료 후 변경 알림 발행 유틸리티.
 *
 * <p>저장소 I/O가 완료될 때까지 기다린 뒤, 성공한 경우에만 키를 발행합니다.
 * 실패는 예외로 전파하지 않고 {@code false}로 보고합니다.</p>
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>true 완료 → 키 발행 후 true</li>
 *   <li>false 완료 → 발행 없이 false</li>
 *   <li>예외 완료 → warn 로그, 발행 없이 false</li>
 * </ul>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class WriteNotifications {

    private static final Logger log = LoggerFactory.getLogger(WriteNotifications.class);

    private WriteNotifications() {
    }

    /**
     * 단일 키 쓰기 완료 후 발행.
     *
     * @param write 저장소 쓰기 future
     * @param bus 변경 버스
     * @param key 변경된 키
     * @return 쓰기 결과 future (예외 완료 없음)
     */
    public static CompletableFuture<Boolean> publishOnSuccess(CompletableFuture<Boolean> write,
                                                              ChangeBus bus,
                                                              String key) {
        return publishOnSuccess(write, bus, List.of(key));
    }

    /**
     * 다중 키 쓰기 완료 후 발행 (전체 삭제 등).
     *
     * @param write 저장소 쓰기 future
     * @param bus 변경 버스
     * @param keys 변경된 키 목록 (발행 순서 유지)
     * @return 쓰기 결과 future (예외 완료 없음)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static CompletableFuture<Boolean> publishOnSuccess(CompletableFuture<Boolean> write,
                                                              ChangeBus bus,
                                                              Collection<String> keys) {
        if (write == null) {
            throw new IllegalArgumentException("write cannot be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        return write.handle((successful, error) -> {
            if (error != null) {
                log.warn("Store write for {} failed", keys, error);
                return false;
            }
            if (!Boolean.TRUE.equals(successful)) {
                log.debug("Store write for {} reported no success, skipping notification", keys);
                return false;
            }
            if (bus.isClosed()) {
                log.warn("Store write for {} completed after the change bus was closed", keys);
                return true;
            }
            for (String key : keys) {
                try {
                    bus.publish(key);
                } catch (IllegalStateException e) {
                    // closed mid-loop, e.g. by a listener of an earlier key
                    log.warn("Change bus closed while publishing {}, remaining keys skipped", keys, e);
                    break;
                }
            }
            return true;
        });
    }
}
