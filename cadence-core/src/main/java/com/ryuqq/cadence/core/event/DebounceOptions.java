package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.loop.Delay;

/**
 * {@link Events#debounce} 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>delay: 조용한 구간 길이 또는 {@link Delay#MICROTASK} (기본 100ms)</li>
 *   <li>leading: 폭주 시작 시점에 즉시 발행 (기본 false)</li>
 *   <li>flushOnListenerRemove: 리스너 제거 직전에 보류 중인 값을 강제 발행 (기본 false)</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 * @param delay 지연 방식 (null 불가)
 * @param leading 선행 발행 여부
 * @param flushOnListenerRemove 리스너 제거 시 강제 발행 여부
 */
public record DebounceOptions(
    Delay delay,
    boolean leading,
    boolean flushOnListenerRemove
) {

    /**
     * 기본 지연 시간 (밀리초).
     */
    public static final long DEFAULT_DELAY_MS = 100;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: delay=100ms, leading=false, flushOnListenerRemove=false</p>
     */
    public DebounceOptions() {
        this(Delay.ofMillis(DEFAULT_DELAY_MS), false, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException delay가 null인 경우
     */
    public DebounceOptions {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
    }

    /**
     * delay만 변경한 새 인스턴스 생성.
     */
    public DebounceOptions withDelay(Delay delay) {
        return new DebounceOptions(delay, leading, flushOnListenerRemove);
    }

    /**
     * delay를 밀리초로 변경한 새 인스턴스 생성.
     */
    public DebounceOptions withDelayMs(long delayMs) {
        return new DebounceOptions(Delay.ofMillis(delayMs), leading, flushOnListenerRemove);
    }

    /**
     * leading만 변경한 새 인스턴스 생성.
     */
    public DebounceOptions withLeading(boolean leading) {
        return new DebounceOptions(delay, leading, flushOnListenerRemove);
    }

    /**
     * flushOnListenerRemove만 변경한 새 인스턴스 생성.
     */
    public DebounceOptions withFlushOnListenerRemove(boolean flushOnListenerRemove) {
        return new DebounceOptions(delay, leading, flushOnListenerRemove);
    }
}
