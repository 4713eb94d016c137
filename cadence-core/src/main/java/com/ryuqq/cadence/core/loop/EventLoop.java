package com.ryuqq.cadence.core.loop;

import com.ryuqq.cadence.core.lifecycle.Disposable;

import java.util.function.Consumer;

/**
 * 단일 스레드 협력 런타임 SPI.
 *
 * <p>모든 타이머, 마이크로태스크, 프레임 틱, 유휴 콜백은 이 인터페이스를 통해 예약됩니다.
 * 병렬 실행은 없으며, 동시성은 콜백 간의 인터리빙으로만 표현됩니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <pre>
 * 1. 매크로태스크 하나 실행 (만료된 타이머, 프레임 틱)
 * 2. 마이크로태스크 큐를 비울 때까지 실행 (실행 중 추가된 것 포함)
 * 3. 실행할 매크로태스크가 없으면 유휴 콜백 하나 실행
 * 4. 1로 돌아감
 * </pre>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link ManualEventLoop}: 호스트가 직접 구동하는 가상 시간 루프 (테스트, 자체 프레임 루프를 가진 호스트)</li>
 *   <li>{@code SingleThreadEventLoop} (adapter-eventloop 모듈): 전용 스레드 하나로 실제 시간 구동</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public interface EventLoop {

    /**
     * 지연 후 실행할 매크로태스크 예약.
     *
     * <p>같은 만료 시각의 타이머는 예약 순서(FIFO)대로 실행됩니다.
     * 음수 지연은 0으로 취급합니다.</p>
     *
     * @param task 실행할 작업
     * @param delayMs 지연 시간 (밀리초)
     * @return 타이머 취소용 Disposable (실행 후 해제해도 무해)
     */
    Disposable schedule(Runnable task, long delayMs);

    /**
     * 마이크로태스크 예약.
     *
     * <p>현재 매크로태스크가 끝난 직후, 다음 매크로태스크보다 먼저 FIFO로 실행됩니다.</p>
     *
     * @param task 실행할 작업
     */
    void queueMicrotask(Runnable task);

    /**
     * 유휴 콜백 요청.
     *
     * <p>실행할 매크로태스크와 마이크로태스크가 없을 때 호출됩니다.</p>
     *
     * @param callback 유휴 마감 정보를 받는 콜백
     * @return 요청 취소용 Disposable
     */
    Disposable requestIdle(Consumer<IdleDeadline> callback);

    /**
     * 루프 시계 기준 현재 시각.
     *
     * @return 현재 시각 (밀리초)
     */
    long now();

    /**
     * 현재 스레드가 이 루프를 구동 중인지 확인.
     *
     * @return 루프 스레드이면 true
     */
    boolean inEventLoop();

    /**
     * 다음 틱(프레임)에 실행할 작업 예약.
     *
     * <p>기본 구현은 지연 0인 타이머입니다. 렌더링 프레임을 가진 호스트는 재정의할 수 있습니다.</p>
     *
     * @param task 실행할 작업
     * @return 취소용 Disposable
     */
    default Disposable requestFrame(Runnable task) {
        return schedule(task, 0);
    }

    /**
     * {@link Delay}에 따라 작업 예약.
     *
     * <p>마이크로태스크 지연은 취소 플래그로 감싸 취소를 지원합니다.</p>
     *
     * @param task 실행할 작업
     * @param delay 지연 방식
     * @return 취소용 Disposable
     * @throws IllegalArgumentException delay가 null인 경우
     */
    default Disposable schedule(Runnable task, Delay delay) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        if (!delay.isMicrotask()) {
            return schedule(task, delay.millis());
        }
        CancellableMicrotask microtask = new CancellableMicrotask(task);
        queueMicrotask(microtask);
        return microtask;
    }

    /**
     * 취소 가능한 마이크로태스크 래퍼.
     */
    final class CancellableMicrotask implements Runnable, Disposable {

        private Runnable task;

        CancellableMicrotask(Runnable task) {
            this.task = task;
        }

        @Override
        public void run() {
            Runnable toRun = task;
            if (toRun != null) {
                task = null;
                toRun.run();
            }
        }

        @Override
        public void dispose() {
            task = null;
        }
    }
}
