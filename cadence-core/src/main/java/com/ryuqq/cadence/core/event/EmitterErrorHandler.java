package com.ryuqq.cadence.core.event;

/**
 * 프로세스 전역 리스너 예외 처리기.
 *
 * <p>{@link Emitter#setGlobalErrorHandler(EmitterErrorHandler)}로 설치하며, 인스턴스 단위
 * {@link ListenerErrorHandler}가 없는 모든 Emitter에 적용됩니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EmitterErrorHandler {

    /**
     * 리스너가 던진 예외 처리.
     *
     * @param emitter 예외가 발생한 Emitter
     * @param error 리스너가 던진 예외
     * @param value 발생 중이던 이벤트 값
     */
    void handle(Emitter<?> emitter, Throwable error, Object value);
}
