package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.cancellation.CancellationError;
import com.ryuqq.cadence.core.cancellation.CancellationToken;
import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;
import com.ryuqq.cadence.core.loop.IdleDeadline;

import java.util.concurrent.CompletableFuture;

/**
 * 이벤트 루프 기반 대기 유틸리티.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class Async {

    private Async() {
    }

    /**
     * 지정 시간 후 완료되는 future.
     *
     * @param loop 이벤트 루프
     * @param millis 대기 시간 (밀리초)
     * @return 대기 결과
     */
    public static CompletableFuture<Void> timeout(EventLoop loop, long millis) {
        return timeout(loop, millis, CancellationToken.NONE);
    }

    /**
     * 취소 가능한 대기.
     *
     * <p>토큰이 취소되면 타이머를 해제하고 {@link CancellationError}로 실패합니다.</p>
     *
     * @param loop 이벤트 루프
     * @param millis 대기 시간 (밀리초)
     * @param token 취소 토큰
     * @return 대기 결과
     * @throws IllegalArgumentException loop 또는 token이 null인 경우
     */
    public static CompletableFuture<Void> timeout(EventLoop loop, long millis, CancellationToken token) {
        requireLoop(loop);
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationError());
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        Disposable[] subscription = new Disposable[1];
        Disposable timer = loop.schedule(() -> {
            if (subscription[0] != null) {
                subscription[0].dispose();
            }
            result.complete(null);
        }, millis);
        subscription[0] = token.onCancellationRequested().subscribe(ignored -> {
            timer.dispose();
            result.completeExceptionally(new CancellationError());
        });
        return result;
    }

    /**
     * 다음 프레임에 완료되는 future.
     *
     * @param loop 이벤트 루프
     * @return 요청 시점부터 경과한 시간 (밀리초)
     */
    public static CompletableFuture<Long> nextFrame(EventLoop loop) {
        requireLoop(loop);
        long start = loop.now();
        CompletableFuture<Long> result = new CompletableFuture<>();
        loop.requestFrame(() -> result.complete(loop.now() - start));
        return result;
    }

    /**
     * 다음 유휴 구간에 완료되는 future.
     *
     * @param loop 이벤트 루프
     * @return 유휴 마감 정보
     */
    public static CompletableFuture<IdleDeadline> nextIdle(EventLoop loop) {
        requireLoop(loop);
        CompletableFuture<IdleDeadline> result = new CompletableFuture<>();
        loop.requestIdle(result::complete);
        return result;
    }

    private static void requireLoop(EventLoop loop) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
    }
}
