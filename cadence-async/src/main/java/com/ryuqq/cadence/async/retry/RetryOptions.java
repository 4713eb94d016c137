package com.ryuqq.cadence.async.retry;

/**
 * {@link Retry} 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>retries: 3</li>
 *   <li>delayMs: 100</li>
 *   <li>multiplier: 2.0</li>
 *   <li>maxDelayMs: 300000</li>
 *   <li>jitterFactor: 0.0</li>
 * </ul>
 *
 * @param retries 최초 시도 이후 재시도 횟수 (0 이상)
 * @param delayMs 첫 재시도 전 대기 시간 (밀리초, 0 이상)
 * @param multiplier 재시도마다 곱해지는 배수 (양수)
 * @param maxDelayMs 대기 시간 상한 (밀리초, delayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @author Cadence Team
 * @since 1.0.0
 */
public record RetryOptions(
    int retries,
    long delayMs,
    double multiplier,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * Compact Constructor (검증 로직).
     */
    public RetryOptions {
        if (retries < 0) {
            throw new IllegalArgumentException("retries cannot be negative (current: " + retries + ")");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
        }
        if (multiplier <= 0.0) {
            throw new IllegalArgumentException("multiplier must be positive (current: " + multiplier + ")");
        }
        if (maxDelayMs < delayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= delayMs (delay: " + delayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public RetryOptions() {
        this(3, 100, 2.0, 300000, 0.0);
    }

    /**
     * 재시도 횟수 변경.
     */
    public RetryOptions withRetries(int retries) {
        return new RetryOptions(retries, delayMs, multiplier, maxDelayMs, jitterFactor);
    }

    /**
     * 첫 대기 시간 변경.
     */
    public RetryOptions withDelayMs(long delayMs) {
        return new RetryOptions(retries, delayMs, multiplier, Math.max(maxDelayMs, delayMs), jitterFactor);
    }

    /**
     * 배수 변경.
     */
    public RetryOptions withMultiplier(double multiplier) {
        return new RetryOptions(retries, delayMs, multiplier, maxDelayMs, jitterFactor);
    }

    /**
     * 대기 시간 상한 변경.
     */
    public RetryOptions withMaxDelayMs(long maxDelayMs) {
        return new RetryOptions(retries, delayMs, multiplier, maxDelayMs, jitterFactor);
    }

    /**
     * Jitter 비율 변경.
     */
    public RetryOptions withJitterFactor(double jitterFactor) {
        return new RetryOptions(retries, delayMs, multiplier, maxDelayMs, jitterFactor);
    }

    /**
     * 이 설정의 백오프 계산기.
     *
     * @return 계산기
     */
    public BackoffCalculator toBackoffCalculator() {
        return new BackoffCalculator(delayMs, multiplier, maxDelayMs, jitterFactor);
    }
}
