package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.function.Consumer;

/**
 * 구간당 최대 한 번 호출하는 단순 속도 제한기.
 *
 * <p>구간 안의 호출은 하나로 합쳐지며, 구간 경계에서 가장 마지막 인자로 한 번 호출됩니다.
 * 한 인스턴스로 감싼 모든 함수는 같은 구간을 공유합니다.</p>
 *
 * <pre>{@code
 * RateLimiter limiter = new RateLimiter(1000, loop);
 * Consumer<Progress> report = limiter.wrap(this::sendProgress);
 * }</pre>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class RateLimiter implements Disposable {

    private final long intervalMs;
    private final EventLoop loop;

    private boolean invoked;
    private long lastTime;
    private Disposable timer;
    private Runnable pendingCall;

    /**
     * 생성자.
     *
     * @param intervalMs 호출 간 최소 간격 (밀리초, 양수)
     * @param loop 이벤트 루프
     * @throws IllegalArgumentException 인자 검증 실패 시
     */
    public RateLimiter(long intervalMs, EventLoop loop) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.intervalMs = intervalMs;
        this.loop = loop;
    }

    /**
     * 인자를 받는 함수를 감쌉니다.
     *
     * @param fn 대상 함수
     * @param <A> 인자 타입
     * @return 속도가 제한된 함수
     * @throws IllegalArgumentException fn이 null인 경우
     */
    public <A> Consumer<A> wrap(Consumer<A> fn) {
        if (fn == null) {
            throw new IllegalArgumentException("fn cannot be null");
        }
        return arg -> call(() -> fn.accept(arg));
    }

    /**
     * 인자 없는 함수를 감쌉니다.
     *
     * @param fn 대상 함수
     * @return 속도가 제한된 함수
     * @throws IllegalArgumentException fn이 null인 경우
     */
    public Runnable wrap(Runnable fn) {
        if (fn == null) {
            throw new IllegalArgumentException("fn cannot be null");
        }
        return () -> call(fn);
    }

    /**
     * 대기 중인 호출과 타이머를 버립니다.
     */
    public void cancel() {
        if (timer != null) {
            timer.dispose();
            timer = null;
        }
        pendingCall = null;
    }

    @Override
    public void dispose() {
        cancel();
    }

    private void call(Runnable invocation) {
        long now = loop.now();
        long elapsed = now - lastTime;
        if (!invoked || elapsed >= intervalMs) {
            invoked = true;
            lastTime = now;
            invocation.run();
            return;
        }
        pendingCall = invocation;
        if (timer == null) {
            timer = loop.schedule(this::onWindowEnd, intervalMs - elapsed);
        }
    }

    private void onWindowEnd() {
        timer = null;
        Runnable call = pendingCall;
        pendingCall = null;
        if (call != null) {
            lastTime = loop.now();
            call.run();
        }
    }
}
