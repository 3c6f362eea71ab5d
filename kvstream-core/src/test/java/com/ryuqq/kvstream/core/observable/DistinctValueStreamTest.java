package com.ryuqq.kvstream.core.observable;

import com.ryuqq.kvstream.core.adapter.IntAdapter;
import com.ryuqq.kvstream.core.bus.BroadcastChangeBus;
import com.ryuqq.kvstream.core.guard.RateGuard;
import com.ryuqq.kvstream.core.support.FakeKeyValueStore;
import com.ryuqq.kvstream.core.support.Recorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * DistinctValueStream 테스트.
 *
 * @author KvStream Team
 * @since 1.0.0
 */
class DistinctValueStreamTest {

    private ObservableValue<Integer> counter;

    @BeforeEach
    void setUp() {
        StoreBinding binding = new StoreBinding(new FakeKeyValueStore(), new BroadcastChangeBus(), RateGuard.disabled());
        counter = ObservableValue.of(binding, "counter", 0, IntAdapter.INSTANCE);
    }

    @Test
    void 같은_값이_연속되면_한번만_전달한다() {
        // given
        Recorder<Integer> recorder = new Recorder<>();
        counter.distinct().subscribe(recorder);

        // when
        counter.set(5);
        counter.set(5);
        counter.set(6);

        // then
        assertThat(recorder.values()).containsExactly(0, 5, 6);
    }

    @Test
    void seed가_있으면_재생_값이_seed와_같을때_전달하지_않는다() {
        // given
        Recorder<Integer> recorder = new Recorder<>();
        new DistinctValueStream<>(counter, counter::currentValue).subscribe(recorder);

        // when
        counter.set(0);
        counter.set(1);

        // then
        assertThat(recorder.values()).containsExactly(1);
    }

    @Test
    void 구조적_동등성으로_비교한다() {
        // given
        ValueStream<List<String>> source = observer -> {
            observer.onNext(new ArrayList<>(List.of("a")));
            observer.onNext(new ArrayList<>(List.of("a")));
            observer.onNext(List.of("b"));
            return mock(Subscription.class);
        };
        Recorder<List<String>> recorder = new Recorder<>();

        // when
        new DistinctValueStream<>(source).subscribe(recorder);

        // then
        assertThat(recorder.values()).containsExactly(List.of("a"), List.of("b"));
    }

    @Test
    void 배열도_내용으로_비교한다() {
        // given
        ValueStream<int[]> source = observer -> {
            observer.onNext(new int[] {1, 2});
            observer.onNext(new int[] {1, 2});
            return mock(Subscription.class);
        };
        List<int[]> received = new ArrayList<>();

        // when
        new DistinctValueStream<>(source).subscribe(received::add);

        // then
        assertThat(received).hasSize(1);
        assertThat(Arrays.equals(received.get(0), new int[] {1, 2})).isTrue();
    }

    @Test
    void 구독별로_상태를_따로_가진다() {
        // given
        ValueStream<Integer> distinct = counter.distinct();
        Recorder<Integer> first = new Recorder<>();
        Recorder<Integer> second = new Recorder<>();
        distinct.subscribe(first);
        counter.set(3);

        // when
        distinct.subscribe(second);

        // then
        assertThat(first.values()).containsExactly(0, 3);
        assertThat(second.values()).containsExactly(3);
    }

    @Test
    void cancel은_원본_구독을_해제한다() {
        // given
        Subscription upstream = mock(Subscription.class);
        ValueStream<Integer> source = observer -> upstream;

        // when
        new DistinctValueStream<>(source).subscribe(value -> { }).cancel();

        // then
        verify(upstream).cancel();
    }

    @Test
    void 취소_후_새_구독은_깨끗한_상태로_시작한다() {
        // given
        ValueStream<Integer> distinct = counter.distinct();
        Recorder<Integer> first = new Recorder<>();
        distinct.subscribe(first).cancel();
        Recorder<Integer> second = new Recorder<>();

        // when
        distinct.subscribe(second);

        // then
        assertThat(second.values()).containsExactly(0);
    }

    @Test
    void 오류와_완료는_그대로_전달한다() {
        // given
        IllegalStateException failure = new IllegalStateException("read failed");
        ValueStream<Integer> source = observer -> {
            observer.onError(failure);
            observer.onComplete();
            return mock(Subscription.class);
        };
        Recorder<Integer> recorder = new Recorder<>();

        // when
        new DistinctValueStream<>(source).subscribe(recorder);

        // then
        assertThat(recorder.errors()).containsExactly(failure);
        assertThat(recorder.completions()).isEqualTo(1);
    }

    @Test
    void null_source는_거부한다() {
        assertThatThrownBy(() -> new DistinctValueStream<Integer>(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("source cannot be null");
    }
}
