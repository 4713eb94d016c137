package com.ryuqq.cadence.async.retry;

import com.ryuqq.cadence.async.AsyncTask;
import com.ryuqq.cadence.async.Futures;
import com.ryuqq.cadence.core.loop.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * 실패한 비동기 작업을 지수 백오프로 재시도.
 *
 * <p>작업은 최대 {@code retries + 1}번 실행됩니다. n번째 재시도 전 대기 시간은
 * {@code delayMs * multiplier^(n-1)}이며, 모두 실패하면 마지막 예외로 실패합니다.</p>
 *
 * <p>취소를 인지하지 않습니다. 중단이 필요하면 작업이 직접 토큰을 확인해야 합니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private Retry() {
    }

    /**
     * 기본 설정으로 재시도.
     *
     * @param factory 작업 팩토리
     * @param loop 이벤트 루프
     * @param <T> 결과 타입
     * @return 최종 결과
     */
    public static <T> CompletableFuture<T> retry(AsyncTask<T> factory, EventLoop loop) {
        return retry(factory, new RetryOptions(), loop);
    }

    /**
     * 재시도 실행.
     *
     * @param factory 작업 팩토리
     * @param options 재시도 설정
     * @param loop 이벤트 루프
     * @param <T> 결과 타입
     * @return 최종 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T> CompletableFuture<T> retry(AsyncTask<T> factory, RetryOptions options, EventLoop loop) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(factory, options, options.toBackoffCalculator(), loop, 0, result);
        return result;
    }

    private static <T> void attempt(
            AsyncTask<T> factory,
            RetryOptions options,
            BackoffCalculator backoff,
            EventLoop loop,
            int retriesDone,
            CompletableFuture<T> result) {
        Futures.invoke(factory).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            if (retriesDone >= options.retries()) {
                result.completeExceptionally(cause);
                return;
            }
            int nextAttempt = retriesDone + 1;
            long delayMs = backoff.calculate(nextAttempt);
            log.debug("Attempt failed, retrying in {}ms (retry {}/{}): {}",
                delayMs, nextAttempt, options.retries(), cause.toString());
            loop.schedule(() -> attempt(factory, options, backoff, loop, nextAttempt, result), delayMs);
        });
    }
}
