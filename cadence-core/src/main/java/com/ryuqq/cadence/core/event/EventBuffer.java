package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 한 틱 동안 들어온 항목을 모아 다음 프레임에 한 번에 내보내는 버퍼.
 *
 * <p>로그 패널처럼 짧은 시간에 수백 건이 도착하는 갱신을 한 번의 처리로 묶을 때 사용합니다.</p>
 *
 * <pre>{@code
 * EventBuffer<LogEntry> logBuffer = new EventBuffer<>(loop);
 * compiler.onLog().subscribe(logBuffer::push);
 * logBuffer.onFlush().subscribe(entries -> logPanel.append(entries));
 * }</pre>
 *
 * @param <T> 항목 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class EventBuffer<T> implements Disposable {

    private final EventLoop loop;
    private final Emitter<List<T>> onFlush = new Emitter<>();

    private List<T> buffer = new ArrayList<>();
    private Disposable scheduledFrame;
    private boolean disposed;

    /**
     * 생성자.
     *
     * @param loop 프레임을 예약할 EventLoop
     * @throws IllegalArgumentException loop가 null인 경우
     */
    public EventBuffer(EventLoop loop) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        this.loop = loop;
    }

    /**
     * 버퍼를 비울 때 발생하는 Event.
     *
     * @return flush Event
     */
    public Event<List<T>> onFlush() {
        return onFlush.event();
    }

    /**
     * 항목 추가. 다음 프레임에 flush가 예약됩니다.
     *
     * @param item 항목
     */
    public void push(T item) {
        if (disposed) {
            return;
        }
        buffer.add(item);
        if (scheduledFrame == null) {
            scheduledFrame = loop.requestFrame(() -> {
                scheduledFrame = null;
                if (!disposed) {
                    flush();
                }
            });
        }
    }

    /**
     * 여러 항목 추가.
     *
     * @param items 항목들
     */
    public void pushMany(Collection<? extends T> items) {
        for (T item : items) {
            push(item);
        }
    }

    /**
     * 즉시 flush. 버퍼가 비어 있으면 아무것도 하지 않습니다.
     */
    public void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<T> toFlush = buffer;
        buffer = new ArrayList<>();
        onFlush.fire(toFlush);
    }

    /**
     * 현재 버퍼 크기.
     *
     * @return 항목 수
     */
    public int size() {
        return buffer.size();
    }

    @Override
    public void dispose() {
        disposed = true;
        if (scheduledFrame != null) {
            scheduledFrame.dispose();
            scheduledFrame = null;
        }
        buffer = new ArrayList<>();
        onFlush.dispose();
    }
}
