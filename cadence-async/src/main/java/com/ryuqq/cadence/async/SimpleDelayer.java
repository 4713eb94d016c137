package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.cancellation.CancellationError;
import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.concurrent.CompletableFuture;

/**
 * 호출마다 자기 결과를 갖는 지연 실행기.
 *
 * <p>{@link Delayer}와 달리 결과를 공유하지 않습니다. 새 trigger는 아직 끝나지 않은 이전 결과를
 * {@link CancellationError}로 실패시킨 뒤 자기 타이머를 시작합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class SimpleDelayer<T> implements Disposable {

    private final long defaultDelayMs;
    private final EventLoop loop;

    private Disposable timer;
    private CompletableFuture<T> pending;

    /**
     * 생성자.
     *
     * @param defaultDelayMs 기본 지연 (밀리초, 0 이상)
     * @param loop 이벤트 루프
     * @throws IllegalArgumentException 인자 검증 실패 시
     */
    public SimpleDelayer(long defaultDelayMs, EventLoop loop) {
        if (defaultDelayMs < 0) {
            throw new IllegalArgumentException(
                "defaultDelayMs cannot be negative (current: " + defaultDelayMs + ")"
            );
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.defaultDelayMs = defaultDelayMs;
        this.loop = loop;
    }

    /**
     * 기본 지연으로 작업 예약.
     *
     * @param task 작업
     * @return 이 호출의 결과
     */
    public CompletableFuture<T> trigger(AsyncTask<T> task) {
        return trigger(task, defaultDelayMs);
    }

    /**
     * 작업 예약.
     *
     * @param task 작업
     * @param delayMs 지연 (밀리초)
     * @return 이 호출의 결과
     * @throws IllegalArgumentException task가 null인 경우
     */
    public CompletableFuture<T> trigger(AsyncTask<T> task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        cancel();
        CompletableFuture<T> result = new CompletableFuture<>();
        pending = result;
        timer = loop.schedule(() -> {
            timer = null;
            Futures.invoke(task).whenComplete((value, error) -> {
                if (pending == result) {
                    pending = null;
                }
                Futures.settle(result, value, error);
            });
        }, delayMs);
        return result;
    }

    /**
     * 타이머 대기 여부.
     *
     * @return 타이머가 걸려 있으면 true
     */
    public boolean isTriggered() {
        return timer != null;
    }

    /**
     * 대기 중인 결과를 {@link CancellationError}로 실패시킵니다. 대기 중인 것이 없으면 아무것도 하지 않습니다.
     */
    public void cancel() {
        if (timer != null) {
            timer.dispose();
            timer = null;
        }
        CompletableFuture<T> previous = pending;
        pending = null;
        if (previous != null) {
            previous.completeExceptionally(new CancellationError("SimpleDelayer task cancelled"));
        }
    }

    @Override
    public void dispose() {
        cancel();
    }
}
