package com.ryuqq.cadence.core.loop;

import java.util.function.LongSupplier;

/**
 * 유휴 콜백에 전달되는 마감 정보.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class IdleDeadline {

    /**
     * 유휴 구간 기본 예산 (밀리초).
     */
    public static final long DEFAULT_BUDGET_MS = 50;

    private final boolean didTimeout;
    private final long deadline;
    private final LongSupplier clock;

    /**
     * 생성자.
     *
     * @param didTimeout 타임아웃으로 강제 호출되었는지 여부
     * @param deadline 유휴 구간이 끝나는 시각 (루프 시계 기준)
     * @param clock 루프 시계
     */
    public IdleDeadline(boolean didTimeout, long deadline, LongSupplier clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.didTimeout = didTimeout;
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * 타임아웃으로 호출되었는지 여부.
     *
     * @return 타임아웃이면 true
     */
    public boolean didTimeout() {
        return didTimeout;
    }

    /**
     * 남은 유휴 시간.
     *
     * @return 남은 시간 (밀리초, 0 이상)
     */
    public long timeRemaining() {
        return Math.max(0, deadline - clock.getAsLong());
    }
}
