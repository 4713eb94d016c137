package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.lifecycle.Disposable;

/**
 * 입력 Event를 교체할 수 있는 중계기.
 *
 * <p>바깥으로 노출되는 {@link #event()}는 고정이고, {@link #setInput(Event)}로 상류만 바꿉니다.</p>
 *
 * <pre>{@code
 * Relay<FileChange> relay = new Relay<>();
 * relay.event().subscribe(this::handleChange);
 *
 * relay.setInput(localWatcher.onDidChange());
 * relay.setInput(remoteWatcher.onDidChange());   // 이전 입력 구독은 해제됨
 * }</pre>
 *
 * @param <T> 이벤트 값 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class Relay<T> implements Disposable {

    private final Emitter<T> emitter = new Emitter<>();
    private Disposable inputSubscription;
    private boolean disposed;

    /**
     * 고정된 출력 Event.
     *
     * @return 출력 Event
     */
    public Event<T> event() {
        return emitter.event();
    }

    /**
     * 입력 교체. 이전 입력 구독을 해제하고 새 입력을 구독합니다.
     *
     * @param input 새 입력 (null이면 분리만 함)
     */
    public void setInput(Event<T> input) {
        if (inputSubscription != null) {
            inputSubscription.dispose();
            inputSubscription = null;
        }
        if (input == null || disposed) {
            return;
        }
        inputSubscription = input.subscribe(value -> {
            if (!disposed) {
                emitter.fire(value);
            }
        });
    }

    @Override
    public void dispose() {
        disposed = true;
        if (inputSubscription != null) {
            inputSubscription.dispose();
            inputSubscription = null;
        }
        emitter.dispose();
    }
}
