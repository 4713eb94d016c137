package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.cancellation.CancellationError;
import com.ryuqq.cadence.core.cancellation.CancellationTokenSource;
import com.ryuqq.cadence.core.lifecycle.Disposable;

import java.util.concurrent.CompletableFuture;

/**
 * 한 번에 하나의 작업만 실행하는 스로틀러.
 *
 * <p>작업 실행 중 들어온 요청은 대기열 한 칸에 들어가며, 나중 요청이 이전 요청을 대체합니다.
 * 실행 중이던 작업이 성공하든 실패하든 끝나면 대기 중인 마지막 작업이 실행되고, 실행 중에
 * 들어온 모든 호출은 그 작업의 결과를 받습니다.</p>
 *
 * <pre>{@code
 * Throttler<Index> throttler = new Throttler<>();
 * throttler.queue(token -> rebuild("a"));   // 즉시 실행
 * throttler.queue(token -> rebuild("b"));   // 대기
 * throttler.queue(token -> rebuild("c"));   // "b"를 대체, 두 호출 모두 "c"의 결과
 * }</pre>
 *
 * <p>모든 작업은 하나의 취소 토큰을 공유하며, 이 토큰은 {@link #dispose()}에서 취소됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class Throttler<T> implements Disposable {

    private static final String DISPOSED_MESSAGE = "Throttler is disposed";

    private final CancellationTokenSource cancellationSource = new CancellationTokenSource();

    private CompletableFuture<T> active;
    private CompletableFuture<T> queued;
    private CancellableTask<T> queuedFactory;

    /**
     * 작업 요청.
     *
     * @param factory 작업 팩토리
     * @return 이 호출이 받을 결과
     * @throws IllegalArgumentException factory가 null인 경우
     */
    public CompletableFuture<T> queue(CancellableTask<T> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (cancellationSource.token().isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationError(DISPOSED_MESSAGE));
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        if (active != null) {
            queuedFactory = factory;
            if (queued == null) {
                queued = new CompletableFuture<>();
            }
            Futures.forward(queued, result);
            return result;
        }

        CompletableFuture<T> running = Futures.invoke(() -> factory.run(cancellationSource.token()));
        active = running;
        // 완료 처리는 하나의 콜백에서 순서대로 수행
        running.whenComplete((value, error) -> {
            if (active == running) {
                active = null;
            }
            Futures.settle(result, value, error);
            runQueued();
        });
        return result;
    }

    /**
     * 작업 실행 중 여부.
     *
     * @return 실행 중이면 true
     */
    public boolean isThrottling() {
        return active != null;
    }

    /**
     * 공유 토큰을 취소합니다. 이후 요청과 대기 중인 요청은 {@link CancellationError}로 실패합니다.
     */
    @Override
    public void dispose() {
        cancellationSource.cancel();
        cancellationSource.dispose();
    }

    private void runQueued() {
        CompletableFuture<T> next = queued;
        if (next == null) {
            return;
        }
        queued = null;
        CancellableTask<T> factory = queuedFactory;
        queuedFactory = null;
        if (cancellationSource.token().isCancellationRequested()) {
            next.completeExceptionally(new CancellationError(DISPOSED_MESSAGE));
            return;
        }
        Futures.forward(queue(factory), next);
    }
}
