package com.ryuqq.cadence.core.cancellation;

import com.ryuqq.cadence.core.event.Emitter;
import com.ryuqq.cadence.core.event.Event;
import com.ryuqq.cadence.core.lifecycle.Disposable;

/**
 * Source가 소유하는 가변 토큰.
 *
 * <p>Emitter는 첫 구독 시 지연 생성되며, 취소 시 한 번 발행한 뒤 해제됩니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
final class MutableToken implements CancellationToken {

    private boolean cancelled;
    private Emitter<Void> emitter;

    @Override
    public boolean isCancellationRequested() {
        return cancelled;
    }

    @Override
    public Event<Void> onCancellationRequested() {
        if (cancelled) {
            return listener -> Disposable.NONE;
        }
        if (emitter == null) {
            emitter = new Emitter<>();
        }
        return emitter.event();
    }

    void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (emitter != null) {
            Emitter<Void> toFire = emitter;
            emitter = null;
            toFire.fire(null);
            toFire.dispose();
        }
    }

    void dispose() {
        if (emitter != null) {
            emitter.dispose();
            emitter = null;
        }
    }
}
