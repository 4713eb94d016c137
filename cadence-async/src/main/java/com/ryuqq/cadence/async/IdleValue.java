package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.function.Supplier;

/**
 * 유휴 시간에 미리 계산되는 지연 값.
 *
 * <p>생성 시 유휴 콜백을 요청하고, 그 전에 값을 읽으면 즉시 계산한 뒤 유휴 요청을 취소합니다.
 * 계산은 한 번만 수행되며, 계산 중 던진 예외도 캐시되어 읽을 때마다 다시 던져집니다.</p>
 *
 * @param <T> 값 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class IdleValue<T> implements Disposable {

    private final Supplier<T> executor;
    private final Disposable idleHandle;

    private boolean didRun;
    private T value;
    private RuntimeException error;

    /**
     * 생성자.
     *
     * @param executor 값 계산 함수
     * @param loop 이벤트 루프
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public IdleValue(Supplier<T> executor, EventLoop loop) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.executor = executor;
        this.idleHandle = loop.requestIdle(deadline -> doRun());
    }

    /**
     * 값 조회. 아직 계산되지 않았으면 지금 계산합니다.
     *
     * @return 값
     * @throws RuntimeException 계산 함수가 던진 예외
     */
    public T getValue() {
        if (!didRun) {
            idleHandle.dispose();
            doRun();
        }
        if (error != null) {
            throw error;
        }
        return value;
    }

    /**
     * 계산 완료 여부.
     *
     * @return 계산되었으면 true
     */
    public boolean isResolved() {
        return didRun;
    }

    @Override
    public void dispose() {
        idleHandle.dispose();
    }

    private void doRun() {
        if (didRun) {
            return;
        }
        didRun = true;
        try {
            value = executor.get();
        } catch (RuntimeException e) {
            error = e;
        }
    }
}
