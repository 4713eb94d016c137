package com.ryuqq.cadence.testkit.log;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LogCapture 테스트.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
class LogCaptureTest {

    private static final Logger log = LoggerFactory.getLogger(LogCaptureTest.class);

    @Test
    void 레벨별로_포맷된_메시지를_수집함() {
        try (LogCapture logs = LogCapture.forClass(LogCaptureTest.class)) {
            // when
            log.debug("retry {} of {}", 1, 3);
            log.error("failed: {}", "boom");
            log.error("failed again");

            // then
            assertThat(logs.messages(Level.DEBUG)).containsExactly("retry 1 of 3");
            assertThat(logs.count(Level.ERROR)).isEqualTo(2);
            assertThat(logs.events()).hasSize(3);
        }
    }

    @Test
    void close_이후에는_수집하지_않음() {
        // given
        LogCapture logs = LogCapture.forClass(LogCaptureTest.class);
        log.warn("captured");

        // when
        logs.close();
        log.warn("not captured");

        // then
        assertThat(logs.messages(Level.WARN)).containsExactly("captured");
    }

    @Test
    void clear_수집_내용을_비움() {
        try (LogCapture logs = LogCapture.forClass(LogCaptureTest.class)) {
            log.info("first");

            logs.clear();

            assertThat(logs.events()).isEmpty();
        }
    }

    @Test
    void null_클래스는_거부함() {
        assertThatThrownBy(() -> LogCapture.forClass(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("type cannot be null");
    }
}
