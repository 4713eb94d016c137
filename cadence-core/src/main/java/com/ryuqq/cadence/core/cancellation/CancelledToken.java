package com.ryuqq.cadence.core.cancellation;

import com.ryuqq.cadence.core.event.Event;
import com.ryuqq.cadence.core.lifecycle.Disposable;

/**
 * 이미 취소된 토큰.
 *
 * <p>취소 이벤트는 이미 지나갔으므로 등록한 리스너는 호출되지 않습니다.
 * 호출자는 {@link #isCancellationRequested()}를 먼저 확인해야 합니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
final class CancelledToken implements CancellationToken {

    static final CancelledToken INSTANCE = new CancelledToken();

    private static final Event<Void> PASSED = listener -> Disposable.NONE;

    private CancelledToken() {
    }

    @Override
    public boolean isCancellationRequested() {
        return true;
    }

    @Override
    public Event<Void> onCancellationRequested() {
        return PASSED;
    }

    @Override
    public String toString() {
        return "CancellationToken.CANCELLED";
    }
}
