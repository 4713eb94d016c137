package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.lifecycle.DisposableStore;

import java.util.Collection;
import java.util.function.Consumer;

/**
 * 타입이 지정된 구독 함수.
 *
 * <p>리스너를 등록하고, 등록 해제용 {@link Disposable}을 반환합니다.
 * {@link Emitter#event()}가 만들거나 {@link Events}의 조합자가 기존 Event로부터 만듭니다.</p>
 *
 * <pre>{@code
 * Event<String> onDidSave = emitter.event();
 * onDidSave.subscribe(path -> recompile(path), disposables);
 * }</pre>
 *
 * @param <T> 이벤트 값 타입
 * @author Cadence Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Event<T> {

    /**
     * 리스너 등록.
     *
     * @param listener 이벤트를 받을 리스너
     * @return 등록 해제용 Disposable
     */
    Disposable subscribe(Consumer<? super T> listener);

    /**
     * 리스너를 등록하고 구독을 저장소에 추가.
     *
     * @param listener 이벤트를 받을 리스너
     * @param store 구독을 소유할 저장소
     * @return 등록 해제용 Disposable
     */
    default Disposable subscribe(Consumer<? super T> listener, DisposableStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        return store.add(subscribe(listener));
    }

    /**
     * 리스너를 등록하고 구독을 컬렉션에 추가.
     *
     * @param listener 이벤트를 받을 리스너
     * @param disposables 구독을 담을 컬렉션
     * @return 등록 해제용 Disposable
     */
    default Disposable subscribe(Consumer<? super T> listener, Collection<? super Disposable> disposables) {
        if (disposables == null) {
            throw new IllegalArgumentException("disposables cannot be null");
        }
        Disposable subscription = subscribe(listener);
        disposables.add(subscription);
        return subscription;
    }
}
