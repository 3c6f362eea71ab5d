package com.ryuqq.kvstream.application.store;

import com.ryuqq.kvstream.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.kvstream.core.adapter.DateTimeAdapter;
import com.ryuqq.kvstream.core.adapter.EnumAdapter;
import com.ryuqq.kvstream.core.combine.Combinator;
import com.ryuqq.kvstream.core.combine.CombinatorConfig;
import com.ryuqq.kvstream.core.guard.RateGuardConfig;
import com.ryuqq.kvstream.core.guard.RateGuardViolation;
import com.ryuqq.kvstream.core.observable.ObservableValue;
import com.ryuqq.kvstream.testkit.contract.ControllableKeyValueStore;
import com.ryuqq.kvstream.testkit.support.MutableClock;
import com.ryuqq.kvstream.testkit.support.RecordingObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StreamingKeyValueStore 통합 테스트 (InMemoryKeyValueStore 기반).
 *
 * <p>호출자 관점의 동작을 검증합니다:</p>
 * <ul>
 *   <li>기본값 대체, fan-out, clear 후 기본값</li>
 *   <li>키 목록 집계 뷰와 전체 clear 알림</li>
 *   <li>Combinator 스냅샷</li>
 *   <li>RateGuard 진단</li>
 *   <li>비동기 쓰기 완료 후 발행</li>
 * </ul>
 *
 * @author KvStream Team
 * @since 1.0.0
 */
class StreamingKeyValueStoreTest {

    enum Theme { LIGHT, DARK }

    private InMemoryKeyValueStore backing;
    private StreamingKeyValueStore kv;

    @BeforeEach
    void setUp() {
        backing = new InMemoryKeyValueStore();
        kv = new StreamingKeyValueStore(backing, new StreamingStoreConfig().withRateGuard(RateGuardConfig.disabled()));
    }

    @AfterEach
    void tearDown() {
        kv.close();
    }

    @Test
    void 값이_없으면_기본값을_전달한다() {
        // given
        RecordingObserver<Integer> observer = new RecordingObserver<>();

        // when
        kv.getInt("counter", 10).subscribe(observer);

        // then
        assertThat(observer.values()).containsExactly(10);
    }

    @Test
    void setter로_쓴_값을_모든_구독자가_받는다() {
        // given
        ObservableValue<String> name = kv.getString("name", "");
        RecordingObserver<String> first = new RecordingObserver<>();
        RecordingObserver<String> second = new RecordingObserver<>();
        name.subscribe(first);
        name.subscribe(second);

        // when
        CompletableFuture<Boolean> result = kv.setString("name", "ryu");

        // then
        assertThat(result).isCompletedWithValue(true);
        assertThat(first.values()).containsExactly("", "ryu");
        assertThat(second.values()).containsExactly("", "ryu");
    }

    @Test
    void 모든_기본_타입_setter가_변경을_발행한다() {
        // given
        RecordingObserver<Boolean> bool = new RecordingObserver<>();
        RecordingObserver<Double> ratio = new RecordingObserver<>();
        RecordingObserver<List<String>> tags = new RecordingObserver<>();
        kv.getBool("bool", false).subscribe(bool);
        kv.getDouble("ratio", 0.0).subscribe(ratio);
        kv.getStringList("tags", List.of()).subscribe(tags);

        // when
        kv.setBool("bool", true);
        kv.setDouble("ratio", 0.75);
        kv.setStringList("tags", List.of("a", "b"));

        // then
        assertThat(bool.values()).containsExactly(false, true);
        assertThat(ratio.values()).containsExactly(0.0, 0.75);
        assertThat(tags.values()).containsExactly(List.of(), List.of("a", "b"));
    }

    @Test
    void remove_이후_기본값을_전달한다() {
        // given
        kv.setInt("counter", 3);
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        kv.getInt("counter", 0).subscribe(observer);

        // when
        kv.remove("counter");

        // then
        assertThat(observer.values()).containsExactly(3, 0);
    }

    @Test
    void 사용자_정의_어댑터로_읽고_쓴다() {
        // given
        ObservableValue<Theme> theme = kv.getCustomValue("theme", Theme.LIGHT, EnumAdapter.of(Theme.class));
        ObservableValue<Instant> lastSeen = kv.getCustomValue("lastSeen", Instant.EPOCH, DateTimeAdapter.INSTANCE);
        RecordingObserver<Theme> themes = new RecordingObserver<>();
        theme.subscribe(themes);
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        // when
        kv.setCustomValue("theme", Theme.DARK, EnumAdapter.of(Theme.class));
        lastSeen.set(now);

        // then
        assertThat(themes.values()).containsExactly(Theme.LIGHT, Theme.DARK);
        assertThat(lastSeen.currentValue()).isEqualTo(now);
        assertThat(backing.getString("theme")).isEqualTo("DARK");
    }

    @Test
    void 키_목록_집계_뷰는_추가와_삭제를_반영한다() {
        // given
        kv.setString("x", "1");
        ObservableValue<Set<String>> keys = kv.getKeys();
        RecordingObserver<Set<String>> observer = new RecordingObserver<>();
        keys.subscribe(observer);

        // when
        kv.setString("y", "2");
        kv.remove("x");

        // then
        assertThat(observer.values()).containsExactly(Set.of("x"), Set.of("x", "y"), Set.of("y"));
    }

    @Test
    void 키_목록_집계_뷰는_쓰기를_거부한다() {
        assertThatThrownBy(() -> kv.getKeys().set(Set.of("x")))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> kv.getKeys().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 전체_clear는_기존_키를_모두_발행한다() {
        // given
        kv.setInt("a", 1);
        kv.setString("b", "x");
        RecordingObserver<Integer> a = new RecordingObserver<>();
        RecordingObserver<String> b = new RecordingObserver<>();
        RecordingObserver<Set<String>> keys = new RecordingObserver<>();
        kv.getInt("a", 0).subscribe(a);
        kv.getString("b", "none").subscribe(b);
        kv.getKeys().subscribe(keys);
        List<String> published = new CopyOnWriteArrayList<>();
        kv.changeBus().listen(published::add, () -> { });

        // when
        CompletableFuture<Boolean> result = kv.clear();

        // then
        assertThat(result).isCompletedWithValue(true);
        assertThat(published).containsExactlyInAnyOrder("a", "b");
        assertThat(a.values()).containsExactly(1, 0);
        assertThat(b.values()).containsExactly("x", "none");
        assertThat(keys.lastValue()).isEmpty();
    }

    @Test
    void 쓰기가_거부되면_false를_반환하고_발행하지_않는다() {
        // given
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        kv.getInt("counter", 0).subscribe(observer);
        backing.rejectWrites(true);

        // when
        CompletableFuture<Boolean> result = kv.setInt("counter", 1);

        // then
        assertThat(result).isCompletedWithValue(false);
        assertThat(observer.values()).containsExactly(0);
    }

    @Test
    void 쓰기가_예외로_실패해도_false를_반환한다() {
        // given
        backing.failWritesWith(new IllegalStateException("disk full"));

        // when & then
        assertThat(kv.clear()).isCompletedWithValue(false);
    }

    @Test
    void null_인자는_I_O_전에_거부된다() {
        assertThatThrownBy(() -> kv.getInt(null, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> kv.setString("name", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> kv.setCustomValue("name", "v", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> kv.remove(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(backing.size()).isZero();
    }

    @Test
    void Combinator는_초기_스냅샷과_최신값_결합을_전달한다() {
        // given
        ObservableValue<String> a = kv.getString("A", "a1");
        ObservableValue<String> b = kv.getString("B", "b1");
        RecordingObserver<List<Object>> observer = new RecordingObserver<>();
        Combinator.bind(List.of(a, b), new CombinatorConfig(), observer);

        // when
        a.set("a2");
        a.set("a3");
        b.set("b2");
        a.set("a3");
        b.set("b2");

        // then
        assertThat(observer.values()).containsExactly(
            List.of("a1", "b1"),
            List.of("a2", "b1"),
            List.of("a3", "b1"),
            List.of("a3", "b2")
        );
    }

    @Test
    void close_이후_모든_구독자가_완료된다() {
        // given
        RecordingObserver<Integer> observer = new RecordingObserver<>();
        kv.getInt("counter", 0).subscribe(observer);

        // when
        kv.close();

        // then
        assertThat(observer.isCompleted()).isTrue();
        assertThat(kv.changeBus().isClosed()).isTrue();
    }

    @Nested
    class 비동기_저장소 {

        private ControllableKeyValueStore controllable;
        private StreamingKeyValueStore asyncKv;

        @BeforeEach
        void setUp() {
            controllable = new ControllableKeyValueStore();
            asyncKv = new StreamingKeyValueStore(controllable,
                new StreamingStoreConfig().withRateGuard(RateGuardConfig.disabled()));
        }

        @Test
        void 쓰기가_완료된_뒤에만_발행한다() {
            // given
            RecordingObserver<Integer> observer = new RecordingObserver<>();
            asyncKv.getInt("counter", 0).subscribe(observer);
            controllable.holdWrites();

            // when
            CompletableFuture<Boolean> result = asyncKv.setInt("counter", 1);

            // then
            assertThat(result).isNotDone();
            assertThat(observer.values()).containsExactly(0);

            // when
            controllable.completeNext(true);

            // then
            assertThat(result).isCompletedWithValue(true);
            assertThat(observer.values()).containsExactly(0, 1);
        }

        @Test
        void 실패한_쓰기는_발행하지_않는다() {
            // given
            RecordingObserver<Integer> observer = new RecordingObserver<>();
            asyncKv.getInt("counter", 0).subscribe(observer);
            controllable.holdWrites();
            CompletableFuture<Boolean> result = asyncKv.setInt("counter", 1);

            // when
            controllable.failNext(new IllegalStateException("io"));

            // then
            assertThat(result).isCompletedWithValue(false);
            assertThat(observer.values()).containsExactly(0);
        }

        @Test
        void 같은_키의_동시_쓰기는_둘_다_발행하고_마지막_쓰기가_남는다() {
            // given
            RecordingObserver<Integer> observer = new RecordingObserver<>();
            asyncKv.getInt("counter", 0).subscribe(observer);
            controllable.holdWrites();
            asyncKv.setInt("counter", 1);
            asyncKv.setInt("counter", 2);

            // when
            controllable.completeAll(true);

            // then
            assertThat(observer.values()).containsExactly(0, 1, 2);
            assertThat(asyncKv.getInt("counter", 0).currentValue()).isEqualTo(2);
        }
    }

    @Nested
    class 재구독_진단 {

        private MutableClock clock;
        private List<RateGuardViolation> violations;
        private StreamingKeyValueStore guarded;

        @BeforeEach
        void setUp() {
            clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
            violations = new CopyOnWriteArrayList<>();
            guarded = new StreamingKeyValueStore(InMemoryKeyValueStore.of(Map.of("counter", 1)),
                new StreamingStoreConfig().withClock(clock).withRateGuardListener(violations::add));
        }

        @Test
        void 새로_만든_ObservableValue를_750ms_안에_4번_구독하면_진단한다() {
            // when
            for (int i = 0; i < 4; i++) {
                guarded.getInt("counter", 0).subscribe(value -> { });
                clock.advanceMillis(200);
            }

            // then
            assertThat(violations).hasSize(1);
            assertThat(violations.get(0).key()).isEqualTo("counter");
        }

        @Test
        void 구독_간격이_250ms면_진단하지_않는다() {
            // when
            for (int i = 0; i < 8; i++) {
                guarded.getInt("counter", 0).subscribe(value -> { });
                clock.advanceMillis(250);
            }

            // then
            assertThat(violations).isEmpty();
        }

        @Test
        void 진단은_구독을_막지_않는다() {
            // given
            RecordingObserver<Integer> observer = new RecordingObserver<>();

            // when
            for (int i = 0; i < 4; i++) {
                guarded.getInt("counter", 0).subscribe(observer);
            }

            // then
            assertThat(violations).hasSize(1);
            assertThat(observer.values()).containsExactly(1, 1, 1, 1);
        }

        @Test
        void 런타임에_진단을_끌_수_있다() {
            // given
            guarded.rateGuard().setEnabled(false);

            // when
            for (int i = 0; i < 4; i++) {
                guarded.getInt("counter", 0).subscribe(value -> { });
            }

            // then
            assertThat(violations).isEmpty();
        }
    }
}
