package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.ArrayList;
import java.util.List;

/**
 * 일정 시간 동안 들어온 항목을 모아 한 묶음으로 내보냅니다.
 *
 * <p>{@link #add(Object)}마다 타이머가 다시 시작되며, 만료되거나 {@link #flush()}가 호출되면
 * 모인 항목 전체를 한 번에 발행합니다.</p>
 *
 * @param <T> 항목 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class EventCoalescer<T> implements Disposable {

    private final long delayMs;
    private final EventLoop loop;
    private final Emitter<List<T>> onFlush = new Emitter<>();

    private List<T> buffer = new ArrayList<>();
    private Disposable timer;
    private boolean disposed;

    /**
     * 생성자.
     *
     * @param delayMs 마지막 항목 후 대기 시간 (밀리초, 0 이상)
     * @param loop 타이머를 예약할 EventLoop
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EventCoalescer(long delayMs, EventLoop loop) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
        }
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.delayMs = delayMs;
        this.loop = loop;
    }

    /**
     * 묶음이 발행될 때 발생하는 Event.
     *
     * @return flush Event
     */
    public Event<List<T>> onFlush() {
        return onFlush.event();
    }

    /**
     * 항목 추가 후 타이머 재시작.
     *
     * @param item 항목
     */
    public void add(T item) {
        if (disposed) {
            return;
        }
        buffer.add(item);
        cancelTimer();
        timer = loop.schedule(this::flush, delayMs);
    }

    /**
     * 즉시 발행. 타이머는 취소됩니다.
     */
    public void flush() {
        cancelTimer();
        if (buffer.isEmpty()) {
            return;
        }
        List<T> toFlush = buffer;
        buffer = new ArrayList<>();
        onFlush.fire(toFlush);
    }

    /**
     * 현재 모인 항목 수.
     *
     * @return 항목 수
     */
    public int size() {
        return buffer.size();
    }

    @Override
    public void dispose() {
        disposed = true;
        cancelTimer();
        buffer = new ArrayList<>();
        onFlush.dispose();
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.dispose();
            timer = null;
        }
    }
}
