package com.ryuqq.cadence.adapter.eventloop;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventLoopConfig 테스트.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
class EventLoopConfigTest {

    @Test
    void 기본값() {
        EventLoopConfig config = new EventLoopConfig();

        assertThat(config.threadName()).isEqualTo("cadence-event-loop");
        assertThat(config.daemon()).isTrue();
        assertThat(config.idleBudgetMs()).isEqualTo(50);
    }

    @Test
    void with_메서드는_한_항목만_변경함() {
        EventLoopConfig config = new EventLoopConfig().withDaemon(false).withIdleBudgetMs(10);

        assertThat(config.threadName()).isEqualTo("cadence-event-loop");
        assertThat(config.daemon()).isFalse();
        assertThat(config.idleBudgetMs()).isEqualTo(10);
    }

    @Test
    void 잘못된_값은_거부함() {
        assertThatThrownBy(() -> new EventLoopConfig().withThreadName(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("threadName cannot be null or blank");
        assertThatThrownBy(() -> new EventLoopConfig().withIdleBudgetMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("idleBudgetMs must be positive (current: 0)");
    }
}
