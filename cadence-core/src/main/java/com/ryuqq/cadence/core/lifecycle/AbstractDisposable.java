package com.ryuqq.cadence.core.lifecycle;

/**
 * 하위 리소스를 소유하는 클래스의 기반 클래스.
 *
 * <p>내부 {@link DisposableStore}에 {@link #register(Disposable)}로 등록한 리소스는
 * {@link #dispose()} 시 함께 해제됩니다.</p>
 *
 * <pre>{@code
 * class CompileTrigger extends AbstractDisposable {
 *     CompileTrigger(Event<String> onChange, EventLoop loop) {
 *         register(onChange.subscribe(path -> scheduler.schedule()));
 *         register(scheduler);
 *     }
 * }
 * }</pre>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public abstract class AbstractDisposable implements Disposable {

    private final DisposableStore store = new DisposableStore();

    /**
     * 하위 리소스 등록.
     *
     * @param disposable 등록할 리소스
     * @param <T> 리소스 타입
     * @return 등록된 리소스
     * @throws IllegalArgumentException 자기 자신을 등록하려는 경우
     */
    protected <T extends Disposable> T register(T disposable) {
        if (disposable == this) {
            throw new IllegalArgumentException("Cannot register a disposable on itself");
        }
        return store.add(disposable);
    }

    /**
     * 해제 여부 확인.
     *
     * @return 해제되었으면 true
     */
    protected boolean isDisposed() {
        return store.isDisposed();
    }

    @Override
    public void dispose() {
        store.dispose();
    }
}
