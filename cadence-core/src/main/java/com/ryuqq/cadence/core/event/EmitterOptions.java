package com.ryuqq.cadence.core.event;

/**
 * Emitter 생명주기 훅 설정 (불변 record).
 *
 * <p>모든 항목은 선택 사항이며 null이면 호출하지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>onWillAddFirstListener: 첫 리스너가 추가되기 직전 (상류 구독 시작에 사용)</li>
 *   <li>onDidAddFirstListener: 첫 리스너가 추가된 직후 (버퍼 재생에 사용)</li>
 *   <li>onWillRemoveListener: 리스너가 제거되기 직전 (강제 flush에 사용)</li>
 *   <li>onDidRemoveLastListener: 마지막 리스너가 제거된 직후 (상류 구독 해제에 사용)</li>
 *   <li>onListenerError: 리스너 예외 처리기 (전역 처리기보다 우선)</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 * @param onWillAddFirstListener 첫 리스너 추가 직전 훅
 * @param onDidAddFirstListener 첫 리스너 추가 직후 훅
 * @param onWillRemoveListener 리스너 제거 직전 훅
 * @param onDidRemoveLastListener 마지막 리스너 제거 직후 훅
 * @param onListenerError 인스턴스 단위 리스너 예외 처리기
 */
public record EmitterOptions(
    Runnable onWillAddFirstListener,
    Runnable onDidAddFirstListener,
    Runnable onWillRemoveListener,
    Runnable onDidRemoveLastListener,
    ListenerErrorHandler onListenerError
) {

    /**
     * 훅 없는 기본 설정 생성자.
     */
    public EmitterOptions() {
        this(null, null, null, null, null);
    }

    /**
     * onWillAddFirstListener만 변경한 새 인스턴스 생성.
     */
    public EmitterOptions withOnWillAddFirstListener(Runnable onWillAddFirstListener) {
        return new EmitterOptions(onWillAddFirstListener, onDidAddFirstListener, onWillRemoveListener, onDidRemoveLastListener, onListenerError);
    }

    /**
     * onDidAddFirstListener만 변경한 새 인스턴스 생성.
     */
    public EmitterOptions withOnDidAddFirstListener(Runnable onDidAddFirstListener) {
        return new EmitterOptions(onWillAddFirstListener, onDidAddFirstListener, onWillRemoveListener, onDidRemoveLastListener, onListenerError);
    }

    /**
     * onWillRemoveListener만 변경한 새 인스턴스 생성.
     */
    public EmitterOptions withOnWillRemoveListener(Runnable onWillRemoveListener) {
        return new EmitterOptions(onWillAddFirstListener, onDidAddFirstListener, onWillRemoveListener, onDidRemoveLastListener, onListenerError);
    }

    /**
     * onDidRemoveLastListener만 변경한 새 인스턴스 생성.
     */
    public EmitterOptions withOnDidRemoveLastListener(Runnable onDidRemoveLastListener) {
        return new EmitterOptions(onWillAddFirstListener, onDidAddFirstListener, onWillRemoveListener, onDidRemoveLastListener, onListenerError);
    }

    /**
     * onListenerError만 변경한 새 인스턴스 생성.
     */
    public EmitterOptions withOnListenerError(ListenerErrorHandler onListenerError) {
        return new EmitterOptions(onWillAddFirstListener, onDidAddFirstListener, onWillRemoveListener, onDidRemoveLastListener, onListenerError);
    }
}
