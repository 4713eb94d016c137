package com.ryuqq.cadence.core.cancellation;

import com.ryuqq.cadence.core.event.Event;

/**
 * 협력적 취소 토큰 (sealed interface).
 *
 * <p>실행 중인 작업이 스스로 확인해야 하는 취소 신호입니다. 토큰 자체는 읽기 전용이며,
 * 취소는 {@link CancellationTokenSource}를 통해서만 요청됩니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link NeverCancelledToken}: 절대 취소되지 않음 ({@link #NONE})</li>
 *   <li>{@link CancelledToken}: 이미 취소됨 ({@link #CANCELLED})</li>
 *   <li>{@link MutableToken}: Source가 소유하며 정확히 한 번 취소됨</li>
 * </ul>
 *
 * <p>{@link #NONE}과 {@link #CANCELLED}에 등록한 리스너는 호출되지 않습니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public sealed interface CancellationToken permits NeverCancelledToken, CancelledToken, MutableToken {

    /**
     * 절대 취소되지 않는 토큰.
     */
    CancellationToken NONE = NeverCancelledToken.INSTANCE;

    /**
     * 이미 취소된 토큰.
     */
    CancellationToken CANCELLED = CancelledToken.INSTANCE;

    /**
     * 취소 요청 여부.
     *
     * @return 취소가 요청되었으면 true
     */
    boolean isCancellationRequested();

    /**
     * 취소 요청 이벤트.
     *
     * <p>취소가 요청되는 순간 정확히 한 번 발생합니다.</p>
     *
     * @return 취소 요청 Event
     */
    Event<Void> onCancellationRequested();

    /**
     * 취소가 요청되었으면 {@link CancellationError}를 던집니다.
     *
     * @throws CancellationError 취소가 요청된 경우
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationError();
        }
    }

    /**
     * 취소 토큰 여부 확인.
     *
     * @param candidate 검사할 객체
     * @return CancellationToken이면 true
     */
    static boolean isCancellationToken(Object candidate) {
        return candidate instanceof CancellationToken;
    }
}
