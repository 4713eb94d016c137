package com.ryuqq.cadence.core.event;

/**
 * {@link Events#debounceWithMaxWait} 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>delayMs: 마지막 이벤트 후 조용한 구간 길이 (기본 100ms)</li>
 *   <li>maxWaitMs: 폭주의 첫 이벤트부터 강제 발행까지 최대 대기 시간 (0이면 제한 없음, 기본 0)</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 * @param delayMs 조용한 구간 (밀리초, 0 이상)
 * @param maxWaitMs 최대 대기 (밀리초, 0이면 제한 없음)
 */
public record MaxWaitDebounceOptions(
    long delayMs,
    long maxWaitMs
) {

    /**
     * 최대 대기 제한 없음.
     */
    public static final long NO_MAX_WAIT = 0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: delayMs=100ms, maxWaitMs=0 (제한 없음)</p>
     */
    public MaxWaitDebounceOptions() {
        this(DebounceOptions.DEFAULT_DELAY_MS, NO_MAX_WAIT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MaxWaitDebounceOptions {
        if (delayMs < 0) {
            throw new IllegalArgumentException(
                "delayMs cannot be negative (current: " + delayMs + ")"
            );
        }
        if (maxWaitMs < 0) {
            throw new IllegalArgumentException(
                "maxWaitMs cannot be negative (current: " + maxWaitMs + ")"
            );
        }
    }

    /**
     * 최대 대기 제한 여부.
     *
     * @return maxWaitMs가 설정되었으면 true
     */
    public boolean hasMaxWait() {
        return maxWaitMs > NO_MAX_WAIT;
    }

    /**
     * delayMs만 변경한 새 인스턴스 생성.
     */
    public MaxWaitDebounceOptions withDelayMs(long delayMs) {
        return new MaxWaitDebounceOptions(delayMs, maxWaitMs);
    }

    /**
     * maxWaitMs만 변경한 새 인스턴스 생성.
     */
    public MaxWaitDebounceOptions withMaxWaitMs(long maxWaitMs) {
        return new MaxWaitDebounceOptions(delayMs, maxWaitMs);
    }
}
