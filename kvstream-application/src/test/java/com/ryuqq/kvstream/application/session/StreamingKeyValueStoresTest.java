package com.ryuqq.kvstream.application.session;

import com.ryuqq.kvstream.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.kvstream.application.store.StreamingKeyValueStore;
import com.ryuqq.kvstream.core.spi.KeyValueStore;
import com.ryuqq.kvstream.core.spi.KeyValueStoreProvider;
import com.ryuqq.kvstream.testkit.support.RecordingObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * StreamingKeyValueStores 전역 세션 테스트.
 *
 * @author KvStream Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StreamingKeyValueStoresTest {

    @Mock
    private KeyValueStoreProvider provider;

    @AfterEach
    void tearDown() {
        StreamingKeyValueStores.resetForTesting();
    }

    @Test
    void 같은_future를_반환하고_provider는_한번만_연다() {
        // given
        when(provider.open()).thenReturn(CompletableFuture.completedFuture(new InMemoryKeyValueStore()));

        // when
        CompletableFuture<StreamingKeyValueStore> first = StreamingKeyValueStores.instance(provider);
        CompletableFuture<StreamingKeyValueStore> second = StreamingKeyValueStores.instance(provider);

        // then
        assertThat(second).isSameAs(first);
        assertThat(first.join()).isSameAs(second.join());
        verify(provider, times(1)).open();
    }

    @Test
    void 이후_호출의_provider는_무시된다() {
        // given
        when(provider.open()).thenReturn(CompletableFuture.completedFuture(new InMemoryKeyValueStore()));
        KeyValueStoreProvider other = () -> CompletableFuture.failedFuture(new AssertionError("must not open"));

        // when
        StreamingKeyValueStore first = StreamingKeyValueStores.instance(provider).join();
        StreamingKeyValueStore second = StreamingKeyValueStores.instance(other).join();

        // then
        assertThat(second).isSameAs(first);
    }

    @Test
    void 동시_호출도_하나의_세션만_만든다() throws Exception {
        // given
        CompletableFuture<KeyValueStore> opening = new CompletableFuture<>();
        when(provider.open()).thenReturn(opening);
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CompletableFuture<StreamingKeyValueStore>>> results = new ArrayList<>();

        try {
            // when
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return StreamingKeyValueStores.instance(provider);
                }));
            }
            start.countDown();
            List<CompletableFuture<StreamingKeyValueStore>> futures = new ArrayList<>();
            for (Future<CompletableFuture<StreamingKeyValueStore>> result : results) {
                futures.add(result.get(5, TimeUnit.SECONDS));
            }
            opening.complete(new InMemoryKeyValueStore());

            // then
            assertThat(futures).allSatisfy(future -> assertThat(future).isSameAs(futures.get(0)));
            assertThat(futures.get(0).get(5, TimeUnit.SECONDS)).isNotNull();
            verify(provider, times(1)).open();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void 세션으로_쓴_값을_다른_호출자가_관찰한다() {
        // given
        when(provider.open()).thenReturn(CompletableFuture.completedFuture(new InMemoryKeyValueStore()));
        StreamingKeyValueStore reader = StreamingKeyValueStores.instance(provider).join();
        RecordingObserver<String> observer = new RecordingObserver<>();
        reader.getString("name", "").subscribe(observer);

        // when
        StreamingKeyValueStores.instance(provider).join().setString("name", "ryu");

        // then
        assertThat(observer.values()).containsExactly("", "ryu");
    }

    @Test
    void 초기화_실패는_메모이즈되지_않고_재시도할_수_있다() {
        // given
        when(provider.open())
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("locked")))
            .thenReturn(CompletableFuture.completedFuture(new InMemoryKeyValueStore()));

        // when
        CompletableFuture<StreamingKeyValueStore> failed = StreamingKeyValueStores.instance(provider);
        CompletableFuture<StreamingKeyValueStore> retried = StreamingKeyValueStores.instance(provider);

        // then
        assertThat(failed).isCompletedExceptionally();
        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(retried).isNotSameAs(failed);
        assertThat(retried.join()).isNotNull();
        verify(provider, times(2)).open();
    }

    @Test
    void provider가_예외를_던지면_실패한_future를_반환한다() {
        // given
        when(provider.open()).thenThrow(new IllegalStateException("boom"));

        // when
        CompletableFuture<StreamingKeyValueStore> result = StreamingKeyValueStores.instance(provider);

        // then
        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasRootCauseMessage("boom");
    }

    @Test
    void provider가_null을_반환하면_실패한다() {
        // given
        when(provider.open()).thenReturn(CompletableFuture.completedFuture(null));

        // when
        CompletableFuture<StreamingKeyValueStore> result = StreamingKeyValueStores.instance(provider);

        // then
        assertThat(result).isCompletedExceptionally();
    }

    @Test
    void null_provider는_거부된다() {
        assertThatThrownBy(() -> StreamingKeyValueStores.instance(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetForTesting은_이전_세션을_닫고_새_세션을_만든다() {
        // given
        when(provider.open())
            .thenReturn(CompletableFuture.completedFuture(new InMemoryKeyValueStore()))
            .thenReturn(CompletableFuture.completedFuture(new InMemoryKeyValueStore()));
        StreamingKeyValueStore previous = StreamingKeyValueStores.instance(provider).join();
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        previous.getInt("counter", 0).subscribe(observer);

        // when
        StreamingKeyValueStores.resetForTesting();
        StreamingKeyValueStore next = StreamingKeyValueStores.instance(provider).join();

        // then
        assertThat(observer.isCompleted()).isTrue();
        assertThat(previous.changeBus().isClosed()).isTrue();
        assertThat(next).isNotSameAs(previous);
    }
}
