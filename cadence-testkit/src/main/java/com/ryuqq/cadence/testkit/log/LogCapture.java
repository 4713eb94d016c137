package com.ryuqq.cadence.testkit.log;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 테스트 중 특정 로거가 남긴 이벤트를 수집합니다.
 *
 * <p>Logback {@link ListAppender}를 대상 로거에 붙였다가 {@link #close()}에서 떼어냅니다.</p>
 *
 * <pre>{@code
 * try (LogCapture logs = LogCapture.forClass(Retry.class)) {
 *     // ...
 *     assertThat(logs.count(Level.DEBUG)).isEqualTo(2);
 * }
 * }</pre>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class LogCapture implements AutoCloseable {

    private final Logger logger;
    private final Level previousLevel;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private LogCapture(Logger logger) {
        this.logger = logger;
        this.previousLevel = logger.getLevel();
        appender.start();
        logger.addAppender(appender);
    }

    /**
     * 클래스 로거 수집 시작. 로거 레벨은 DEBUG로 낮춥니다.
     *
     * @param type 로거 이름이 될 클래스
     * @return 수집기
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static LogCapture forClass(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Logger logger = (Logger) LoggerFactory.getLogger(type);
        LogCapture capture = new LogCapture(logger);
        logger.setLevel(Level.DEBUG);
        return capture;
    }

    /**
     * 수집된 이벤트.
     *
     * @return 이벤트 스냅샷
     */
    public List<ILoggingEvent> events() {
        synchronized (appender) {
            return List.copyOf(appender.list);
        }
    }

    /**
     * 지정 레벨의 포맷된 메시지.
     *
     * @param level 로그 레벨
     * @return 메시지 목록
     */
    public List<String> messages(Level level) {
        return events().stream()
            .filter(event -> event.getLevel() == level)
            .map(ILoggingEvent::getFormattedMessage)
            .toList();
    }

    /**
     * 지정 레벨의 이벤트 수.
     *
     * @param level 로그 레벨
     * @return 이벤트 수
     */
    public int count(Level level) {
        return messages(level).size();
    }

    /**
     * 수집 내용 비우기.
     */
    public void clear() {
        synchronized (appender) {
            appender.list.clear();
        }
    }

    @Override
    public void close() {
        logger.detachAppender(appender);
        appender.stop();
        logger.setLevel(previousLevel);
    }
}
