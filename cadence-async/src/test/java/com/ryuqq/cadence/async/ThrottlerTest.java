package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.cancellation.CancellationError;
import com.ryuqq.cadence.core.cancellation.CancellationToken;
import com.ryuqq.cadence.core.loop.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Throttler 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>실행 중 요청은 마지막 요청 하나로 합쳐짐</li>
 *   <li>실행 중 작업이 실패해도 대기 작업은 실행됨</li>
 *   <li>dispose 이후 요청과 대기 요청은 CancellationError</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
class ThrottlerTest {

    private ManualEventLoop loop;
    private Throttler<String> throttler;
    private List<String> executed;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        throttler = new Throttler<>();
        executed = new ArrayList<>();
    }

    private CancellableTask<String> task(String name, long durationMs) {
        return token -> {
            executed.add(name);
            return Async.timeout(loop, durationMs).thenApply(ignored -> name);
        };
    }

    // ============================================================
    // 1. 합치기
    // ============================================================

    @Test
    @DisplayName("A(t=0) / B(t=5) / C(t=10), 각 50ms: A → \"A\", B와 C → \"C\", B는 실행되지 않음")
    void 실행_중_요청은_마지막_요청으로_대체됨() {
        // given
        CompletableFuture<String> a = throttler.queue(task("A", 50));
        loop.advanceTo(5);
        CompletableFuture<String> b = throttler.queue(task("B", 50));
        loop.advanceTo(10);
        CompletableFuture<String> c = throttler.queue(task("C", 50));

        // when
        loop.runUntilIdle();

        // then
        assertThat(a).isCompletedWithValue("A");
        assertThat(b).isCompletedWithValue("C");
        assertThat(c).isCompletedWithValue("C");
        assertThat(executed).containsExactly("A", "C");
        assertThat(loop.now()).isEqualTo(100);
    }

    @Test
    void N번_연속_요청하면_팩토리는_정확히_2번_호출됨() {
        // given
        AtomicInteger invocations = new AtomicInteger();
        List<CompletableFuture<String>> results = new ArrayList<>();

        // when
        for (int i = 0; i < 10; i++) {
            String value = "v" + i;
            results.add(throttler.queue(token -> {
                invocations.incrementAndGet();
                return Async.timeout(loop, 10).thenApply(ignored -> value);
            }));
        }
        loop.runUntilIdle();

        // then
        assertThat(invocations).hasValue(2);
        assertThat(results.get(0)).isCompletedWithValue("v0");
        for (int i = 1; i < 10; i++) {
            assertThat(results.get(i)).isCompletedWithValue("v9");
        }
    }

    @Test
    void isThrottling_실행_중에만_true() {
        assertThat(throttler.isThrottling()).isFalse();

        throttler.queue(task("A", 20));
        assertThat(throttler.isThrottling()).isTrue();

        loop.runUntilIdle();
        assertThat(throttler.isThrottling()).isFalse();
    }

    // ============================================================
    // 2. 실패
    // ============================================================

    @Test
    void 실행_중_작업이_실패해도_대기_작업은_실행됨() {
        // given
        IllegalStateException failure = new IllegalStateException("boom");
        CompletableFuture<String> first = throttler.queue(token ->
            Async.timeout(loop, 10).thenCompose(ignored -> CompletableFuture.<String>failedFuture(failure)));
        CompletableFuture<String> second = throttler.queue(task("B", 10));

        // when
        loop.runUntilIdle();

        // then
        assertThatThrownBy(first::join).hasCauseReference(failure);
        assertThat(second).isCompletedWithValue("B");
    }

    @Test
    void 동기적으로_던진_예외는_같은_예외로_실패함() {
        IllegalArgumentException failure = new IllegalArgumentException("sync");

        CompletableFuture<String> result = throttler.queue(token -> {
            throw failure;
        });

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCauseReference(failure);
        assertThat(throttler.isThrottling()).isFalse();
    }

    // ============================================================
    // 3. dispose
    // ============================================================

    @Test
    void dispose_이후_요청은_즉시_CancellationError() {
        throttler.dispose();

        CompletableFuture<String> result = throttler.queue(task("A", 10));

        assertThatThrownBy(result::join)
            .isInstanceOf(CancellationError.class)
            .hasMessageContaining("Throttler is disposed");
        assertThat(executed).isEmpty();
    }

    @Test
    void dispose_대기_중인_요청을_CancellationError로_실패시키고_공유_토큰을_취소함() {
        // given
        AtomicReference<CancellationToken> seen = new AtomicReference<>();
        CompletableFuture<String> active = throttler.queue(token -> {
            seen.set(token);
            return Async.timeout(loop, 10).thenApply(ignored -> "A");
        });
        CompletableFuture<String> waiting = throttler.queue(task("B", 10));

        // when
        throttler.dispose();
        loop.runUntilIdle();

        // then
        assertThat(seen.get().isCancellationRequested()).isTrue();
        assertThat(active).isCompletedWithValue("A");
        assertThatThrownBy(waiting::join).isInstanceOf(CancellationError.class);
        assertThat(executed).isEmpty();
    }

    @Test
    void null_팩토리는_거부함() {
        assertThatThrownBy(() -> throttler.queue(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("factory cannot be null");
    }
}
