package com.ryuqq.cadence.core.loop;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ManualEventLoop 테스트.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
@DisplayName("ManualEventLoop 테스트")
class ManualEventLoopTest {

    private ManualEventLoop loop;
    private List<String> trace;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        trace = new ArrayList<>();
    }

    @Nested
    @DisplayName("타이머")
    class Timers {

        @Test
        @DisplayName("만료 시각 순으로, 같으면 예약 순으로 실행된다")
        void runsInDeadlineThenFifoOrder() {
            // given
            loop.schedule(() -> trace.add("b@20"), 20);
            loop.schedule(() -> trace.add("a@10"), 10);
            loop.schedule(() -> trace.add("c@20"), 20);

            // when
            loop.advanceBy(20);

            // then
            assertThat(trace).containsExactly("a@10", "b@20", "c@20");
        }

        @Test
        @DisplayName("타이머 실행 중 now() 는 타이머의 만료 시각이다")
        void nowIsDeadlineDuringTimer() {
            List<Long> seen = new ArrayList<>();
            loop.schedule(() -> seen.add(loop.now()), 30);

            loop.advanceBy(100);

            assertThat(seen).containsExactly(30L);
            assertThat(loop.now()).isEqualTo(100L);
        }

        @Test
        @DisplayName("음수 지연은 0 으로 취급한다")
        void negativeDelayClampsToZero() {
            loop.schedule(() -> trace.add("ran"), -50);

            loop.runDueTasks();

            assertThat(trace).containsExactly("ran");
            assertThat(loop.now()).isZero();
        }

        @Test
        @DisplayName("반환된 Disposable 로 타이머를 취소할 수 있다")
        void disposeCancelsTimer() {
            Disposable timer = loop.schedule(() -> trace.add("ran"), 10);

            timer.dispose();
            loop.advanceBy(10);

            assertThat(trace).isEmpty();
            assertThat(loop.pendingTimers()).isZero();
        }

        @Test
        @DisplayName("시간을 되돌릴 수 없다")
        void cannotMoveBackwards() {
            loop.advanceBy(10);

            assertThatThrownBy(() -> loop.advanceTo(5))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> loop.advanceBy(-1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("작업 예외는 큐에서 제거된 뒤 호출자에게 전파된다")
        void taskExceptionPropagatesAfterRemoval() {
            loop.schedule(() -> {
                throw new IllegalStateException("boom");
            }, 0);

            assertThatThrownBy(() -> loop.runDueTasks()).hasMessage("boom");
            assertThat(loop.pendingTimers()).isZero();
        }
    }

    @Nested
    @DisplayName("마이크로태스크")
    class Microtasks {

        @Test
        @DisplayName("매크로태스크 하나가 끝나면 다음 매크로태스크 전에 비워진다")
        void drainedAfterEachMacrotask() {
            // given
            loop.schedule(() -> {
                trace.add("timer-1");
                loop.queueMicrotask(() -> trace.add("micro-1"));
                loop.queueMicrotask(() -> trace.add("micro-2"));
            }, 0);
            loop.schedule(() -> trace.add("timer-2"), 0);

            // when
            loop.runDueTasks();

            // then
            assertThat(trace).containsExactly("timer-1", "micro-1", "micro-2", "timer-2");
        }

        @Test
        @DisplayName("실행 중 추가된 마이크로태스크도 같은 구간에서 실행된다")
        void nestedMicrotasksRunInSameDrain() {
            loop.queueMicrotask(() -> {
                trace.add("outer");
                loop.queueMicrotask(() -> trace.add("inner"));
            });

            int count = loop.runMicrotasks();

            assertThat(count).isEqualTo(2);
            assertThat(trace).containsExactly("outer", "inner");
        }

        @Test
        @DisplayName("Delay.MICROTASK 로 예약한 작업은 취소할 수 있다")
        void microtaskDelayIsCancellable() {
            Disposable handle = loop.schedule(() -> trace.add("ran"), Delay.MICROTASK);

            handle.dispose();
            loop.runMicrotasks();

            assertThat(trace).isEmpty();
        }
    }

    @Nested
    @DisplayName("유휴 콜백")
    class Idle {

        @Test
        @DisplayName("runIdleTasks() 에서만 실행되며 남은 예산을 전달한다")
        void runsOnlyWhenPumped() {
            List<Long> budgets = new ArrayList<>();
            loop.requestIdle(deadline -> budgets.add(deadline.timeRemaining()));

            loop.advanceBy(100);
            assertThat(budgets).isEmpty();

            loop.runIdleTasks();
            assertThat(budgets).containsExactly(IdleDeadline.DEFAULT_BUDGET_MS);
        }

        @Test
        @DisplayName("취소된 유휴 요청은 실행되지 않는다")
        void cancelledIdleRequestDoesNotRun() {
            Disposable request = loop.requestIdle(deadline -> trace.add("idle"));

            request.dispose();
            loop.runUntilIdle();

            assertThat(trace).isEmpty();
        }

        @Test
        @DisplayName("runUntilIdle() 은 타이머와 유휴 콜백을 모두 소진한다")
        void runUntilIdleDrainsEverything() {
            // given
            loop.schedule(() -> trace.add("timer@50"), 50);
            loop.requestIdle(deadline -> {
                trace.add("idle");
                loop.schedule(() -> trace.add("timer-from-idle"), 10);
            });

            // when
            loop.runUntilIdle();

            // then
            assertThat(trace).containsExactly("idle", "timer-from-idle", "timer@50");
            assertThat(loop.now()).isEqualTo(50L);
            assertThat(loop.pendingTimers()).isZero();
            assertThat(loop.pendingIdleRequests()).isZero();
        }
    }

    @Test
    @DisplayName("생성한 스레드에서는 inEventLoop() 가 true 이다")
    void inEventLoopOnOwnerThread() throws InterruptedException {
        boolean[] fromOtherThread = new boolean[1];
        Thread other = new Thread(() -> fromOtherThread[0] = loop.inEventLoop());
        other.start();
        other.join();

        assertThat(loop.inEventLoop()).isTrue();
        assertThat(fromOtherThread[0]).isFalse();
    }
}
