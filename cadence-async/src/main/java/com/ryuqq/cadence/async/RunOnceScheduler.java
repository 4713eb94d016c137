package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;

/**
 * 지연 후 한 번 실행되는 재예약 가능한 작업.
 *
 * <p>{@link #schedule()}을 다시 호출하면 타이머가 다시 시작됩니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class RunOnceScheduler implements Disposable {

    private final EventLoop loop;

    private Runnable runner;
    private long delayMs;
    private Disposable timer;

    /**
     * 생성자.
     *
     * @param runner 실행할 작업
     * @param delayMs 기본 지연 (밀리초, 0 이상)
     * @param loop 이벤트 루프
     * @throws IllegalArgumentException 인자 검증 실패 시
     */
    public RunOnceScheduler(Runnable runner, long delayMs, EventLoop loop) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.runner = runner;
        this.loop = loop;
        setDelay(delayMs);
    }

    /**
     * 기본 지연으로 예약. 기존 예약은 취소됩니다.
     */
    public void schedule() {
        schedule(delayMs);
    }

    /**
     * 지정 지연으로 예약. 기존 예약은 취소됩니다.
     *
     * @param delayMs 지연 (밀리초)
     */
    public void schedule(long delayMs) {
        cancel();
        timer = loop.schedule(this::onTimeout, delayMs);
    }

    /**
     * 예약 취소.
     */
    public void cancel() {
        if (timer != null) {
            timer.dispose();
            timer = null;
        }
    }

    /**
     * 예약 여부.
     *
     * @return 예약되어 있으면 true
     */
    public boolean isScheduled() {
        return timer != null;
    }

    /**
     * 예약되어 있으면 즉시 실행.
     */
    public void flush() {
        if (isScheduled()) {
            cancel();
            runIfAlive();
        }
    }

    /**
     * 기본 지연 조회.
     *
     * @return 기본 지연 (밀리초)
     */
    public long getDelay() {
        return delayMs;
    }

    /**
     * 기본 지연 변경.
     *
     * @param delayMs 새 지연 (밀리초, 0 이상)
     * @throws IllegalArgumentException delayMs가 음수인 경우
     */
    public void setDelay(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
        }
        this.delayMs = delayMs;
    }

    @Override
    public void dispose() {
        cancel();
        runner = null;
    }

    private void onTimeout() {
        timer = null;
        runIfAlive();
    }

    private void runIfAlive() {
        if (runner != null) {
            runner.run();
        }
    }
}
