package com.ryuqq.cadence.async.retry;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 배수만큼 지수적으로 늘리고, 선택적으로 Jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * multiplier^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, multiplier=2, jitterFactor=0):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 100ms</li>
 *   <li>attemptCount=2: 200ms</li>
 *   <li>attemptCount=3: 400ms</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=100ms, multiplier=2, maxDelay=300000ms, jitterFactor=0</p>
     */
    public BackoffCalculator() {
        this(100, 2.0, 300000, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param multiplier 지연 배수 (양수)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, double multiplier, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (multiplier <= 0.0) {
            throw new IllegalArgumentException(
                "multiplier must be positive (current: " + multiplier + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 현재 재시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // double 계산 후 maxDelay로 먼저 자르므로 long overflow 없음
        double raw = baseDelayMs * Math.pow(multiplier, attemptCount - 1);
        long exponential = (long) Math.min(raw, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    /**
     * 기본 지연 시간 조회.
     *
     * @return 기본 지연 시간 (밀리초)
     */
    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * 지연 배수 조회.
     *
     * @return 지연 배수
     */
    public double getMultiplier() {
        return multiplier;
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간 (밀리초)
     */
    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Jitter 비율 조회.
     *
     * @return Jitter 비율 (0.0 ~ 1.0)
     */
    public double getJitterFactor() {
        return jitterFactor;
    }
}
