package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.loop.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * IdleValue 유닛 테스트.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
class IdleValueTest {

    private ManualEventLoop loop;
    private AtomicInteger computations;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        computations = new AtomicInteger();
    }

    @Test
    void 유휴_시간에_미리_계산됨() {
        IdleValue<String> value = new IdleValue<>(() -> "v" + computations.incrementAndGet(), loop);
        assertThat(value.isResolved()).isFalse();

        loop.runIdleTasks();

        assertThat(value.isResolved()).isTrue();
        assertThat(value.getValue()).isEqualTo("v1");
        assertThat(computations).hasValue(1);
    }

    @Test
    void 유휴_전에_읽으면_즉시_계산하고_유휴_요청을_취소함() {
        IdleValue<String> value = new IdleValue<>(() -> "v" + computations.incrementAndGet(), loop);

        assertThat(value.getValue()).isEqualTo("v1");
        assertThat(loop.pendingIdleRequests()).isZero();

        loop.runIdleTasks();
        assertThat(computations).hasValue(1);
    }

    @Test
    void 계산_예외는_캐시되어_읽을_때마다_다시_던져짐() {
        IllegalStateException failure = new IllegalStateException("broken");
        IdleValue<String> value = new IdleValue<>(() -> {
            computations.incrementAndGet();
            throw failure;
        }, loop);

        Throwable first = catchThrowable(value::getValue);
        Throwable second = catchThrowable(value::getValue);

        assertThat(first).isSameAs(failure);
        assertThat(second).isSameAs(failure);
        assertThat(computations).hasValue(1);
    }

    @Test
    void dispose_유휴_요청을_취소함() {
        IdleValue<String> value = new IdleValue<>(() -> "v" + computations.incrementAndGet(), loop);

        value.dispose();
        loop.runIdleTasks();

        assertThat(value.isResolved()).isFalse();
        assertThat(computations).hasValue(0);
    }

    @Test
    void null_계산_함수는_거부함() {
        assertThatThrownBy(() -> new IdleValue<String>(null, loop))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executor cannot be null");
    }
}
