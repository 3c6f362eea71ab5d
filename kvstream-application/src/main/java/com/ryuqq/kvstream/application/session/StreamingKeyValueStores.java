package com.ryuqq.kvstream.application.session;

import com.ryuqq.kvstream.application.store.StreamingKeyValueStore;
import com.ryuqq.kvstream.application.store.StreamingStoreConfig;
import com.ryuqq.kvstream.core.spi.KeyValueStore;
import com.ryuqq.kvstream.core.spi.KeyValueStoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 프로세스 전역 스트리밍 저장소 세션.
 *
 * <p>하나의 논리 저장소에 하나의 ChangeBus만 존재해야 모든 호출자가 서로의 쓰기를 관찰할 수 있습니다.
 * 이를 위해 최초 호출 시 하나의 초기화 future를 만들어 메모이즈하고, 이후 호출은 같은 future를 반환합니다.</p>
 *
 * <p><strong>동작 흐름:</strong></p>
 * <pre>
 * instance(provider)
 *   ↓
 * 메모이즈된 future 있음? → 그대로 반환 (다른 provider가 와도 무시)
 *   ↓ 없음
 * CAS로 새 future 등록 (경쟁 시 승자 하나만 provider.open() 호출)
 *   ↓
 * open 성공 → StreamingKeyValueStore 생성 후 complete
 * open 실패 → 메모이즈 해제 후 completeExceptionally (다음 호출에서 재시도)
 * </pre>
 *
 * <p>리셋은 {@link #resetForTesting()}으로만 가능합니다. 암묵적인 리셋은 없습니다.</p>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
public final class StreamingKeyValueStores {

    private static final Logger log = LoggerFactory.getLogger(StreamingKeyValueStores.class);

    private static final AtomicReference<CompletableFuture<StreamingKeyValueStore>> INSTANCE =
        new AtomicReference<>();

    private StreamingKeyValueStores() {
    }

    /**
     * 기본 설정으로 전역 세션 조회 (최초 호출 시 초기화).
     *
     * @param provider 백엔드 저장소 공급자
     * @return 세션 future
     */
    public static CompletableFuture<StreamingKeyValueStore> instance(KeyValueStoreProvider provider) {
        return instance(provider, new StreamingStoreConfig());
    }

    /**
     * 전역 세션 조회 (최초 호출 시 초기화).
     *
     * <p>이미 초기화되었거나 초기화 중이면 provider와 config는 무시됩니다.</p>
     *
     * @param provider 백엔드 저장소 공급자
     * @param config 세션 설정
     * @return 세션 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static CompletableFuture<StreamingKeyValueStore> instance(KeyValueStoreProvider provider,
                                                                     StreamingStoreConfig config) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        while (true) {
            CompletableFuture<StreamingKeyValueStore> existing = INSTANCE.get();
            if (existing != null) {
                return existing;
            }
            CompletableFuture<StreamingKeyValueStore> created = new CompletableFuture<>();
            if (INSTANCE.compareAndSet(null, created)) {
                initialize(provider, config, created);
                return created;
            }
        }
    }

    /**
     * 전역 세션 해제 (테스트 teardown 전용).
     *
     * <p>이전 세션의 ChangeBus를 닫아 남은 구독자에게 완료를 알립니다.
     * 초기화 중인 세션은 초기화가 끝나는 즉시 닫힙니다.</p>
     */
    public static void resetForTesting() {
        CompletableFuture<StreamingKeyValueStore> previous = INSTANCE.getAndSet(null);
        if (previous == null) {
            return;
        }
        log.info("Resetting streaming store session");
        previous.thenAccept(StreamingKeyValueStore::close);
    }

    private static void initialize(KeyValueStoreProvider provider,
                                   StreamingStoreConfig config,
                                   CompletableFuture<StreamingKeyValueStore> created) {
        CompletableFuture<KeyValueStore> opening;
        try {
            opening = provider.open();
        } catch (RuntimeException e) {
            fail(created, e);
            return;
        }
        if (opening == null) {
            fail(created, new IllegalStateException("KeyValueStoreProvider returned a null future"));
            return;
        }
        opening.whenComplete((store, error) -> {
            if (error != null) {
                fail(created, unwrap(error));
                return;
            }
            if (store == null) {
                fail(created, new IllegalStateException("KeyValueStoreProvider resolved to null"));
                return;
            }
            StreamingKeyValueStore session;
            try {
                session = new StreamingKeyValueStore(store, config);
            } catch (RuntimeException e) {
                fail(created, e);
                return;
            }
            log.info("Streaming store session opened over {}", store.getClass().getSimpleName());
            created.complete(session);
        });
    }

    private static void fail(CompletableFuture<StreamingKeyValueStore> created, Throwable error) {
        INSTANCE.compareAndSet(created, null);
        log.warn("Streaming store session initialization failed", error);
        created.completeExceptionally(error);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
