package com.ryuqq.cadence.adapter.eventloop;

/**
 * SingleThreadEventLoop 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadName: 루프 스레드 이름 (기본 "cadence-event-loop")</li>
 *   <li>daemon: 데몬 스레드 여부 (기본 true)</li>
 *   <li>idleBudgetMs: 유휴 콜백에 주는 시간 예산 (기본 50ms)</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 * @param threadName 루프 스레드 이름 (비어 있으면 안 됨)
 * @param daemon 데몬 스레드 여부
 * @param idleBudgetMs 유휴 시간 예산 (밀리초, 양수여야 함)
 */
public record EventLoopConfig(
    String threadName,
    boolean daemon,
    long idleBudgetMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadName="cadence-event-loop", daemon=true, idleBudgetMs=50ms</p>
     */
    public EventLoopConfig() {
        this("cadence-event-loop", true, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EventLoopConfig {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        if (idleBudgetMs <= 0) {
            throw new IllegalArgumentException(
                "idleBudgetMs must be positive (current: " + idleBudgetMs + ")"
            );
        }
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public EventLoopConfig withThreadName(String threadName) {
        return new EventLoopConfig(threadName, daemon, idleBudgetMs);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public EventLoopConfig withDaemon(boolean daemon) {
        return new EventLoopConfig(threadName, daemon, idleBudgetMs);
    }

    /**
     * idleBudgetMs만 변경한 새 인스턴스 생성.
     */
    public EventLoopConfig withIdleBudgetMs(long idleBudgetMs) {
        return new EventLoopConfig(threadName, daemon, idleBudgetMs);
    }
}
