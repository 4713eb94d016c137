package com.ryuqq.cadence.core.lifecycle;

/**
 * 값 하나를 담는 가변 Disposable 슬롯.
 *
 * <p>새 값을 설정하면 이전 값을 먼저 해제합니다. 컨테이너 자체가 해제된 뒤에는
 * 어떤 값을 설정하든 저장하지 않고 즉시 해제합니다 (부활 금지).</p>
 *
 * <pre>{@code
 * MutableDisposable<Disposable> current = new MutableDisposable<>();
 * current.setValue(relay.event().subscribe(this::render));   // 이전 구독은 자동 해제
 * }</pre>
 *
 * @param <T> 담을 Disposable 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class MutableDisposable<T extends Disposable> implements Disposable {

    private T value;
    private boolean disposed;

    /**
     * 현재 값 조회.
     *
     * @return 현재 값, 비어 있거나 컨테이너가 해제되었으면 null
     */
    public T getValue() {
        return disposed ? null : value;
    }

    /**
     * 값 교체.
     *
     * <p>이전 값과 다르면 이전 값을 해제한 뒤 교체합니다.</p>
     *
     * @param newValue 새 값 (null 허용: 비우기)
     */
    public void setValue(T newValue) {
        if (disposed) {
            if (newValue != null) {
                newValue.dispose();
            }
            return;
        }
        if (value == newValue) {
            return;
        }
        T old = value;
        value = newValue;
        if (old != null) {
            old.dispose();
        }
    }

    /**
     * 현재 값을 해제하고 비웁니다. 컨테이너는 계속 사용 가능합니다.
     */
    public void clear() {
        setValue(null);
    }

    /**
     * 해제 여부 확인.
     *
     * @return 해제되었으면 true
     */
    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        T old = value;
        value = null;
        if (old != null) {
            old.dispose();
        }
    }
}
