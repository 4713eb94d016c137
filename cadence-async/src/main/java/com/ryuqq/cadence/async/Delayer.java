package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.cancellation.CancellationError;
import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.Delay;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.concurrent.CompletableFuture;

/**
 * 마지막으로 지정된 작업을 지연 후 한 번 실행.
 *
 * <p>지연 시간 안의 모든 {@link #trigger(AsyncTask)} 호출은 같은 결과를 공유하며, 그 결과는
 * 타이머 만료 직전에 지정된 작업의 결과입니다. 호출할 때마다 타이머가 다시 시작됩니다.</p>
 *
 * <pre>{@code
 * Delayer<Void> delayer = new Delayer<>(Delay.ofMillis(300), loop);
 * onDidType.subscribe(text -> delayer.trigger(() -> validate(text)));
 * }</pre>
 *
 * <p>작업 실행 직전에 공유 결과가 분리되므로, 작업 안에서 다시 trigger하면 새 주기가 시작됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class Delayer<T> implements Disposable {

    private final EventLoop loop;

    private Delay defaultDelay;
    private Disposable timeout;
    private CompletableFuture<Void> gate;
    private CompletableFuture<T> completion;
    private AsyncTask<T> task;

    /**
     * 밀리초 기본 지연으로 생성.
     *
     * @param defaultDelayMs 기본 지연 (밀리초)
     * @param loop 이벤트 루프
     */
    public Delayer(long defaultDelayMs, EventLoop loop) {
        this(Delay.ofMillis(defaultDelayMs), loop);
    }

    /**
     * 생성자.
     *
     * @param defaultDelay 기본 지연
     * @param loop 이벤트 루프
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Delayer(Delay defaultDelay, EventLoop loop) {
        if (defaultDelay == null) {
            throw new IllegalArgumentException("defaultDelay cannot be null");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.defaultDelay = defaultDelay;
        this.loop = loop;
    }

    /**
     * 기본 지연으로 작업 예약.
     *
     * @param task 작업
     * @return 공유 결과
     */
    public CompletableFuture<T> trigger(AsyncTask<T> task) {
        return trigger(task, defaultDelay);
    }

    /**
     * 작업 예약.
     *
     * @param task 작업 (이전에 지정된 작업을 대체)
     * @param delay 지연
     * @return 공유 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CompletableFuture<T> trigger(AsyncTask<T> task, Delay delay) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        this.task = task;
        cancelTimeout();

        if (completion == null) {
            CompletableFuture<Void> newGate = new CompletableFuture<>();
            CompletableFuture<T> newCompletion = new CompletableFuture<>();
            gate = newGate;
            completion = newCompletion;
            newGate.whenComplete((ignored, error) -> {
                if (error != null) {
                    newCompletion.completeExceptionally(Futures.unwrap(error));
                    return;
                }
                if (completion == newCompletion) {
                    completion = null;
                    gate = null;
                }
                AsyncTask<T> toRun = this.task;
                this.task = null;
                Futures.forward(Futures.invoke(toRun), newCompletion);
            });
        }

        CompletableFuture<T> result = completion;
        timeout = loop.schedule(() -> {
            timeout = null;
            releaseGate();
        }, delay);
        return result;
    }

    /**
     * 대기 중인 작업 여부.
     *
     * @return 타이머가 걸려 있으면 true
     */
    public boolean isTriggered() {
        return timeout != null;
    }

    /**
     * 대기 중인 작업을 즉시 실행.
     *
     * @return 공유 결과 (대기 중인 작업이 없으면 null)
     */
    public CompletableFuture<T> flush() {
        if (!isTriggered()) {
            return null;
        }
        cancelTimeout();
        CompletableFuture<T> result = completion;
        releaseGate();
        return result;
    }

    /**
     * 대기 중인 작업을 취소하고 공유 결과를 {@link CancellationError}로 실패시킵니다.
     */
    public void cancel() {
        cancelTimeout();
        CompletableFuture<Void> pendingGate = gate;
        if (completion != null) {
            gate = null;
            completion = null;
            task = null;
            pendingGate.completeExceptionally(new CancellationError("Delayer cancelled"));
        }
    }

    /**
     * 기본 지연 조회.
     *
     * @return 기본 지연
     */
    public Delay getDefaultDelay() {
        return defaultDelay;
    }

    /**
     * 기본 지연 변경. 이미 걸린 타이머에는 영향을 주지 않습니다.
     *
     * @param delay 새 기본 지연
     * @throws IllegalArgumentException delay가 null인 경우
     */
    public void setDelay(Delay delay) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        this.defaultDelay = delay;
    }

    @Override
    public void dispose() {
        cancel();
    }

    private void releaseGate() {
        CompletableFuture<Void> pendingGate = gate;
        if (pendingGate != null) {
            pendingGate.complete(null);
        }
    }

    private void cancelTimeout() {
        if (timeout != null) {
            timeout.dispose();
            timeout = null;
        }
    }
}
