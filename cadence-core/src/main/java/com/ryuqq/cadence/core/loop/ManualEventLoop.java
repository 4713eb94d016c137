package com.ryuqq.cadence.core.loop;

import com.ryuqq.cadence.core.lifecycle.Disposable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/**
 * 호스트가 직접 구동하는 가상 시간 EventLoop.
 *
 * <p>시간은 {@link #advanceBy(long)} / {@link #advanceTo(long)} 호출로만 흐릅니다.
 * 타이머는 만료 시각 순(같으면 예약 순)으로 실행되며, 매크로태스크 하나가 끝날 때마다
 * 마이크로태스크 큐를 비웁니다. 유휴 콜백은 {@link #runIdleTasks()} 또는
 * {@link #runUntilIdle()}에서만 실행됩니다.</p>
 *
 * <p>작업이 던진 예외는 큐에서 제거된 뒤 루프를 구동한 호출자에게 그대로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ManualEventLoop loop = new ManualEventLoop();
 * Delayer<String> delayer = new Delayer<>(Delay.ofMillis(100), loop);
 * CompletableFuture<String> result = delayer.trigger(() -> completedFuture("done"));
 *
 * loop.advanceBy(99);    // 아직 미완료
 * loop.advanceBy(1);     // 완료
 * }</pre>
 *
 * <p>스레드 안전하지 않습니다. 생성한 스레드에서만 사용하세요.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class ManualEventLoop implements EventLoop {

    private static final int MAX_ITERATIONS = 100_000;

    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
            Comparator.comparingLong((Timer t) -> t.deadline).thenComparingLong(t -> t.sequence));
    private final Deque<Runnable> microtasks = new ArrayDeque<>();
    private final List<IdleRequest> idleRequests = new ArrayList<>();
    private final Thread owner;

    private long now;
    private long sequence;

    /**
     * 시각 0에서 시작하는 루프 생성.
     */
    public ManualEventLoop() {
        this(0);
    }

    /**
     * 지정 시각에서 시작하는 루프 생성.
     *
     * @param startTime 시작 시각 (밀리초)
     */
    public ManualEventLoop(long startTime) {
        this.now = startTime;
        this.owner = Thread.currentThread();
    }

    @Override
    public Disposable schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        Timer timer = new Timer(task, now + Math.max(0, delayMs), sequence++);
        timers.add(timer);
        return () -> timers.remove(timer);
    }

    @Override
    public void queueMicrotask(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        microtasks.add(task);
    }

    @Override
    public Disposable requestIdle(Consumer<IdleDeadline> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        IdleRequest request = new IdleRequest(callback);
        idleRequests.add(request);
        return () -> idleRequests.remove(request);
    }

    @Override
    public long now() {
        return now;
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == owner;
    }

    /**
     * 마이크로태스크 큐를 비울 때까지 실행 (실행 중 추가된 것 포함).
     *
     * @return 실행한 마이크로태스크 수
     */
    public int runMicrotasks() {
        int count = 0;
        Runnable task;
        while ((task = microtasks.poll()) != null) {
            count++;
            task.run();
        }
        return count;
    }

    /**
     * 현재 시각 기준으로 만료된 타이머를 모두 실행.
     *
     * <p>실행 중 지연 0으로 예약된 타이머도 같은 호출 안에서 실행됩니다.</p>
     *
     * @return 실행한 타이머 수
     */
    public int runDueTasks() {
        runMicrotasks();
        int count = 0;
        Timer next;
        while ((next = timers.peek()) != null && next.deadline <= now) {
            timers.poll();
            count++;
            runMacrotask(next.task);
        }
        return count;
    }

    /**
     * 지정 시간만큼 가상 시간을 진행하며 그 사이 만료되는 타이머를 실행.
     *
     * @param millis 진행할 시간 (0 이상)
     * @throws IllegalArgumentException millis가 음수인 경우
     */
    public void advanceBy(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative (current: " + millis + ")");
        }
        advanceTo(now + millis);
    }

    /**
     * 지정 시각까지 가상 시간을 진행하며 그 사이 만료되는 타이머를 실행.
     *
     * <p>각 타이머가 실행될 때 {@link #now()}는 그 타이머의 만료 시각입니다.</p>
     *
     * @param time 목표 시각
     * @throws IllegalArgumentException time이 현재 시각보다 이전인 경우
     */
    public void advanceTo(long time) {
        if (time < now) {
            throw new IllegalArgumentException(
                    "time cannot move backwards (current: " + now + ", requested: " + time + ")");
        }
        runMicrotasks();
        Timer next;
        while ((next = timers.peek()) != null && next.deadline <= time) {
            timers.poll();
            now = Math.max(now, next.deadline);
            runMacrotask(next.task);
        }
        now = time;
    }

    /**
     * 현재 등록된 유휴 콜백을 실행.
     *
     * <p>실행 중 새로 요청된 유휴 콜백은 다음 호출에서 실행됩니다.</p>
     *
     * @return 실행한 유휴 콜백 수
     */
    public int runIdleTasks() {
        runMicrotasks();
        List<IdleRequest> snapshot = new ArrayList<>(idleRequests);
        idleRequests.clear();
        int count = 0;
        for (IdleRequest request : snapshot) {
            count++;
            IdleDeadline deadline = new IdleDeadline(false, now + IdleDeadline.DEFAULT_BUDGET_MS, this::now);
            runMacrotask(() -> request.callback.accept(deadline));
        }
        return count;
    }

    /**
     * 대기 중인 작업이 없을 때까지 루프 구동.
     *
     * <p>만료된 타이머, 유휴 콜백 순으로 실행하고, 남은 타이머가 있으면 가장 이른 만료 시각으로
     * 시간을 진행합니다.</p>
     *
     * @throws IllegalStateException 작업이 끝없이 자신을 다시 예약하는 경우
     */
    public void runUntilIdle() {
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            runDueTasks();
            if (!idleRequests.isEmpty()) {
                runIdleTasks();
                continue;
            }
            Timer next = timers.peek();
            if (next == null) {
                return;
            }
            advanceTo(next.deadline);
        }
        throw new IllegalStateException("runUntilIdle exceeded " + MAX_ITERATIONS + " iterations");
    }

    /**
     * 대기 중인 타이머 수.
     *
     * @return 타이머 수
     */
    public int pendingTimers() {
        return timers.size();
    }

    /**
     * 대기 중인 마이크로태스크 수.
     *
     * @return 마이크로태스크 수
     */
    public int pendingMicrotasks() {
        return microtasks.size();
    }

    /**
     * 대기 중인 유휴 콜백 수.
     *
     * @return 유휴 콜백 수
     */
    public int pendingIdleRequests() {
        return idleRequests.size();
    }

    private void runMacrotask(Runnable task) {
        try {
            task.run();
        } finally {
            runMicrotasks();
        }
    }

    private static final class Timer {
        private final Runnable task;
        private final long deadline;
        private final long sequence;

        private Timer(Runnable task, long deadline, long sequence) {
            this.task = task;
            this.deadline = deadline;
            this.sequence = sequence;
        }
    }

    private static final class IdleRequest {
        private final Consumer<IdleDeadline> callback;

        private IdleRequest(Consumer<IdleDeadline> callback) {
            this.callback = callback;
        }
    }
}
