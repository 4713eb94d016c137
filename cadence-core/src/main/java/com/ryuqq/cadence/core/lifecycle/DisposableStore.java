package com.ryuqq.cadence.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 여러 {@link Disposable}을 함께 소유하는 저장소.
 *
 * <p>패널 마운트, 스트리밍 요청 등 하나의 기능 단위가 만든 리소스를 모아 두었다가
 * 기능 종료 시 한 번에 해제합니다.</p>
 *
 * <p><strong>해제 정책 (비대칭):</strong></p>
 * <ul>
 *   <li>{@link #clear()} / {@link #dispose()}: 모든 멤버를 해제합니다. 개별 실패는 수집하여
 *       {@link DisposalException} 하나로 로그에 남기고 다시 던지지 않습니다.</li>
 *   <li>{@link #deleteAndDispose(Disposable)}: 특정 멤버 하나를 해제하며, 그 해제의 실패는
 *       호출자에게 그대로 전파됩니다.</li>
 * </ul>
 *
 * <p><strong>해제 이후 추가:</strong> 이미 해제된 저장소에 {@link #add(Disposable)}하면
 * 저장하지 않고 즉시 해제합니다. 늦게 도착한 등록이 누수되지 않도록 하기 위함입니다.</p>
 *
 * <pre>{@code
 * DisposableStore store = new DisposableStore();
 * store.add(emitter.event().subscribe(this::onChange));
 * store.add(new RunOnceScheduler(this::refresh, 200, loop));
 *
 * // 기능 종료
 * store.dispose();
 * }</pre>
 *
 * <p>단일 스레드 협력 모델을 전제로 하며 동기화하지 않습니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class DisposableStore implements Disposable {

    private static final Logger log = LoggerFactory.getLogger(DisposableStore.class);

    private final Set<Disposable> toDispose = new LinkedHashSet<>();
    private boolean disposed;

    /**
     * 해제 여부 확인.
     *
     * @return {@link #dispose()}가 호출되었으면 true
     */
    public boolean isDisposed() {
        return disposed;
    }

    /**
     * 현재 보관 중인 항목 수.
     *
     * @return 항목 수
     */
    public int size() {
        return toDispose.size();
    }

    /**
     * Disposable 추가.
     *
     * <p>이미 해제된 저장소라면 경고를 남기고 전달된 항목을 즉시 해제합니다.</p>
     *
     * @param disposable 추가할 항목
     * @param <T> 항목 타입
     * @return 전달된 항목 (체이닝용)
     * @throws IllegalArgumentException disposable이 null인 경우
     */
    public <T extends Disposable> T add(T disposable) {
        if (disposable == null) {
            throw new IllegalArgumentException("disposable cannot be null");
        }
        if (disposable == this) {
            throw new IllegalArgumentException("Cannot register a disposable on itself");
        }

        if (disposed) {
            log.warn("Adding to a disposed DisposableStore, disposing immediately");
            disposable.dispose();
            return disposable;
        }

        toDispose.add(disposable);
        return disposable;
    }

    /**
     * 해제하지 않고 저장소에서만 제거 (소유권 이전).
     *
     * @param disposable 제거할 항목
     */
    public void delete(Disposable disposable) {
        toDispose.remove(disposable);
    }

    /**
     * 저장소에서 제거한 뒤 해제.
     *
     * <p>일괄 해제와 달리 실패를 삼키지 않고 로그를 남긴 뒤 호출자에게 다시 던집니다.</p>
     *
     * @param disposable 제거 및 해제할 항목
     * @throws RuntimeException 해당 항목의 해제가 실패한 경우 (원본 예외)
     */
    public void deleteAndDispose(Disposable disposable) {
        if (disposable == null) {
            return;
        }
        toDispose.remove(disposable);
        try {
            disposable.dispose();
        } catch (RuntimeException | Error e) {
            log.error("Error during deleteAndDispose", e);
            throw e;
        }
    }

    /**
     * 모든 항목을 해제하고 비웁니다.
     *
     * <p>저장소 자체는 계속 사용할 수 있습니다. 한 항목의 실패가 나머지 항목의 해제를
     * 막지 않으며, 모든 실패는 해제가 끝난 뒤 한 번에 보고됩니다.</p>
     */
    public void clear() {
        if (toDispose.isEmpty()) {
            return;
        }

        // 해제 도중 delete()가 호출될 수 있으므로 스냅샷을 순회
        List<Disposable> snapshot = new ArrayList<>(toDispose);
        toDispose.clear();

        List<Throwable> errors = new ArrayList<>();
        for (Disposable d : snapshot) {
            try {
                d.dispose();
            } catch (RuntimeException | Error e) {
                errors.add(e);
            }
        }

        if (!errors.isEmpty()) {
            DisposalException aggregate = new DisposalException(errors);
            log.error("{} error(s) during DisposableStore dispose", errors.size(), aggregate);
        }
    }

    /**
     * 저장소를 해제 상태로 바꾸고 모든 항목을 해제합니다 (멱등).
     */
    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        clear();
    }
}
