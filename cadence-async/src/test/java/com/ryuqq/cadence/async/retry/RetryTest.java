package com.ryuqq.cadence.async.retry;

import ch.qos.logback.classic.Level;
import com.ryuqq.cadence.core.loop.ManualEventLoop;
import com.ryuqq.cadence.testkit.log.LogCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Retry 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>대기 시간 = delayMs * multiplier^n</li>
 *   <li>모두 실패하면 마지막 예외</li>
 *   <li>재시도마다 DEBUG 로그</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
class RetryTest {

    private ManualEventLoop loop;
    private LogCapture logs;
    private List<Long> attemptTimes;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        logs = LogCapture.forClass(Retry.class);
        attemptTimes = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        logs.close();
    }

    @Test
    void 두번_실패한_뒤_성공하면_지수_백오프_간격으로_재시도함() {
        // given
        CompletableFuture<String> result = Retry.retry(() -> {
            attemptTimes.add(loop.now());
            if (attemptTimes.size() < 3) {
                throw new IllegalStateException("attempt " + attemptTimes.size());
            }
            return completedFuture("ok");
        }, new RetryOptions(), loop);

        // when
        loop.runUntilIdle();

        // then
        assertThat(result).isCompletedWithValue("ok");
        assertThat(attemptTimes).containsExactly(0L, 100L, 300L);
        assertThat(logs.count(Level.DEBUG)).isEqualTo(2);
    }

    @Test
    void 모두_실패하면_마지막_예외로_실패함() {
        // given
        List<RuntimeException> thrown = new ArrayList<>();
        CompletableFuture<String> result = Retry.retry(() -> {
            attemptTimes.add(loop.now());
            RuntimeException failure = new IllegalStateException("attempt " + attemptTimes.size());
            thrown.add(failure);
            return CompletableFuture.<String>failedFuture(failure);
        }, new RetryOptions().withRetries(2).withDelayMs(10).withMultiplier(3.0), loop);

        // when
        loop.runUntilIdle();

        // then
        assertThat(attemptTimes).containsExactly(0L, 10L, 40L);
        assertThatThrownBy(result::join).hasCauseReference(thrown.get(2));
        assertThat(logs.messages(Level.DEBUG)).hasSize(2);
        assertThat(logs.messages(Level.DEBUG).get(0)).contains("retrying in 10ms");
    }

    @Test
    void 재시도_0회면_한_번만_실행함() {
        CompletableFuture<String> result = Retry.retry(() -> {
            attemptTimes.add(loop.now());
            throw new IllegalStateException("once");
        }, new RetryOptions().withRetries(0), loop);

        loop.runUntilIdle();

        assertThat(attemptTimes).hasSize(1);
        assertThat(result).isCompletedExceptionally();
        assertThat(logs.events()).isEmpty();
    }
}
