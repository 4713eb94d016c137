package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.lifecycle.Disposables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 타입이 지정된 발행/구독 기본 요소.
 *
 * <p>리스너는 구독 순서대로 동기 호출됩니다. {@link #fire(Object)}는 호출 전에 리스너 목록의
 * 스냅샷을 만들기 때문에, 발행 도중 추가되거나 제거된 리스너는 이번 발행에 영향을 주지 않습니다.</p>
 *
 * <p><strong>리스너 예외 처리:</strong></p>
 * <ol>
 *   <li>인스턴스 처리기 ({@link EmitterOptions#onListenerError()})가 있으면 호출</li>
 *   <li>없으면 전역 처리기 ({@link #setGlobalErrorHandler(EmitterErrorHandler)})가 있으면 호출</li>
 *   <li>항상 ERROR 로그를 남김</li>
 * </ol>
 * <p>한 리스너의 예외는 다른 리스너 호출을 막지 않습니다.</p>
 *
 * <pre>{@code
 * class FileWatcher implements Disposable {
 *     private final Emitter<Path> onDidChange = new Emitter<>();
 *
 *     public Event<Path> onDidChange() {
 *         return onDidChange.event();
 *     }
 *
 *     void changed(Path path) {
 *         onDidChange.fire(path);
 *     }
 *
 *     public void dispose() {
 *         onDidChange.dispose();
 *     }
 * }
 * }</pre>
 *
 * @param <T> 이벤트 값 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class Emitter<T> implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(Emitter.class);

    private static volatile EmitterErrorHandler globalErrorHandler;

    private final Set<ListenerEntry<T>> listeners = new LinkedHashSet<>();
    private EmitterOptions options;
    private Event<T> event;
    private boolean disposed;

    /**
     * 훅 없는 Emitter 생성.
     */
    public Emitter() {
        this(new EmitterOptions());
    }

    /**
     * 생명주기 훅을 지정한 Emitter 생성.
     *
     * @param options 훅 설정
     * @throws IllegalArgumentException options가 null인 경우
     */
    public Emitter(EmitterOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.options = options;
    }

    /**
     * 전역 리스너 예외 처리기 설치.
     *
     * @param handler 처리기 (null이면 제거)
     */
    public static void setGlobalErrorHandler(EmitterErrorHandler handler) {
        globalErrorHandler = handler;
    }

    /**
     * 구독 함수.
     *
     * <p>매번 같은 인스턴스를 반환합니다. 해제된 Emitter에 구독하면 {@link Disposable#NONE}을 반환합니다.</p>
     *
     * @return 구독 함수
     */
    public Event<T> event() {
        if (event == null) {
            event = this::addListener;
        }
        return event;
    }

    /**
     * 이벤트 발행.
     *
     * <p>해제된 Emitter에서는 아무것도 하지 않습니다.</p>
     *
     * @param value 이벤트 값
     */
    public void fire(T value) {
        if (disposed || listeners.isEmpty()) {
            return;
        }
        List<ListenerEntry<T>> snapshot = new ArrayList<>(listeners);
        for (ListenerEntry<T> entry : snapshot) {
            try {
                entry.listener.accept(value);
            } catch (RuntimeException | Error e) {
                handleListenerError(e, value);
            }
        }
    }

    /**
     * 리스너 존재 여부.
     *
     * @return 리스너가 하나 이상이면 true
     */
    public boolean hasListeners() {
        return !listeners.isEmpty();
    }

    /**
     * 해제 여부.
     *
     * @return 해제되었으면 true
     */
    public boolean isDisposed() {
        return disposed;
    }

    /**
     * 모든 리스너를 제거합니다. 리스너가 남아 있었다면 onDidRemoveLastListener 훅을 호출합니다.
     */
    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        boolean hadListeners = !listeners.isEmpty();
        listeners.clear();
        Runnable onDidRemoveLast = options.onDidRemoveLastListener();
        options = new EmitterOptions();
        if (hadListeners) {
            runHook(onDidRemoveLast);
        }
    }

    private Disposable addListener(Consumer<? super T> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (disposed) {
            return Disposable.NONE;
        }
        boolean firstListener = listeners.isEmpty();
        if (firstListener) {
            runHook(options.onWillAddFirstListener());
        }
        ListenerEntry<T> entry = new ListenerEntry<>(listener);
        listeners.add(entry);
        if (firstListener) {
            runHook(options.onDidAddFirstListener());
        }
        return Disposables.toDisposable(() -> removeListener(entry));
    }

    private void removeListener(ListenerEntry<T> entry) {
        if (disposed || !listeners.contains(entry)) {
            return;
        }
        runHook(options.onWillRemoveListener());
        listeners.remove(entry);
        if (listeners.isEmpty()) {
            runHook(options.onDidRemoveLastListener());
        }
    }

    private void handleListenerError(Throwable error, T value) {
        ListenerErrorHandler instanceHandler = options.onListenerError();
        EmitterErrorHandler globalHandler = globalErrorHandler;
        if (instanceHandler != null) {
            try {
                instanceHandler.onListenerError(error, value);
            } catch (RuntimeException handlerError) {
                log.error("Error in listener error handler", handlerError);
            }
        } else if (globalHandler != null) {
            try {
                globalHandler.handle(this, error, value);
            } catch (RuntimeException handlerError) {
                log.error("Error in global emitter error handler", handlerError);
            }
        }
        log.error("Listener threw error", error);
    }

    private static void runHook(Runnable hook) {
        if (hook != null) {
            hook.run();
        }
    }

    private static final class ListenerEntry<T> {
        private final Consumer<? super T> listener;

        private ListenerEntry(Consumer<? super T> listener) {
            this.listener = listener;
        }
    }
}
