package com.ryuqq.cadence.core.cancellation;

import com.ryuqq.cadence.core.event.Event;
import com.ryuqq.cadence.core.lifecycle.Disposable;

/**
 * 절대 취소되지 않는 토큰.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
final class NeverCancelledToken implements CancellationToken {

    static final NeverCancelledToken INSTANCE = new NeverCancelledToken();

    private static final Event<Void> NEVER = listener -> Disposable.NONE;

    private NeverCancelledToken() {
    }

    @Override
    public boolean isCancellationRequested() {
        return false;
    }

    @Override
    public Event<Void> onCancellationRequested() {
        return NEVER;
    }

    @Override
    public String toString() {
        return "CancellationToken.NONE";
    }
}
