package com.ryuqq.cadence.core.event;

/**
 * Emitter 인스턴스 단위 리스너 예외 처리기.
 *
 * <p>{@link EmitterOptions#onListenerError()}로 주입합니다. 지정되면 전역
 * {@link EmitterErrorHandler}보다 우선합니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ListenerErrorHandler {

    /**
     * 리스너가 던진 예외 처리.
     *
     * @param error 리스너가 던진 예외
     * @param value 발생 중이던 이벤트 값
     */
    void onListenerError(Throwable error, Object value);
}
