package com.ryuqq.cadence.adapter.eventloop;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.loop.EventLoop;
import com.ryuqq.cadence.core.loop.IdleDeadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 전용 스레드 하나에서 실시간으로 동작하는 EventLoop.
 *
 * <p>모든 콜백은 루프 스레드에서 실행되므로 Cadence 기본 요소를 잠금 없이 사용할 수 있습니다.
 * 작업 예약은 어느 스레드에서나 가능합니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>마이크로태스크 (FIFO)</li>
 *   <li>만료된 타이머 하나 (만료 시각, 예약 순)</li>
 *   <li>실행할 것이 없으면 유휴 콜백</li>
 * </ol>
 *
 * <p>작업이 던진 예외는 ERROR 로그를 남기고 루프는 계속 동작합니다.</p>
 *
 * <pre>{@code
 * SingleThreadEventLoop loop = new SingleThreadEventLoop(new EventLoopConfig());
 * Delayer<Void> delayer = loop.submit(() -> new Delayer<Void>(300, loop)).join();
 * ...
 * loop.shutdown();
 * loop.awaitTermination(5, TimeUnit.SECONDS);
 * }</pre>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class SingleThreadEventLoop implements EventLoop, Disposable {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final EventLoopConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
        Comparator.comparingLong((Timer t) -> t.deadline).thenComparingLong(t -> t.sequence));
    private final Deque<Runnable> microtasks = new ArrayDeque<>();
    private final List<IdleRequest> idleRequests = new ArrayList<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final long startNanos = System.nanoTime();
    private final Thread thread;

    private long sequence;
    private volatile boolean shutdown;

    /**
     * 루프 생성 및 스레드 시작.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SingleThreadEventLoop(EventLoopConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.thread = new Thread(this::runLoop, config.threadName());
        this.thread.setDaemon(config.daemon());
        this.thread.start();
        log.info("Event loop started (thread: {})", config.threadName());
    }

    @Override
    public Disposable schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        lock.lock();
        try {
            if (shutdown) {
                log.warn("Ignoring task scheduled after shutdown (thread: {})", config.threadName());
                return Disposable.NONE;
            }
            Timer timer = new Timer(task, now() + Math.max(0, delayMs), sequence++);
            timers.add(timer);
            wakeup.signal();
            return () -> removeTimer(timer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void queueMicrotask(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        lock.lock();
        try {
            if (shutdown) {
                log.warn("Ignoring microtask queued after shutdown (thread: {})", config.threadName());
                return;
            }
            microtasks.add(task);
            wakeup.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Disposable requestIdle(Consumer<IdleDeadline> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        lock.lock();
        try {
            if (shutdown) {
                return Disposable.NONE;
            }
            IdleRequest request = new IdleRequest(callback);
            idleRequests.add(request);
            wakeup.signal();
            return () -> removeIdleRequest(request);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long now() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    /**
     * 작업을 다음 매크로태스크로 실행.
     *
     * @param task 작업
     * @throws IllegalStateException 루프가 종료된 경우
     */
    public void execute(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("Event loop is shut down: " + config.threadName());
        }
        schedule(task, 0);
    }

    /**
     * 작업을 루프 스레드에서 실행하고 결과를 돌려받습니다.
     *
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws IllegalStateException 루프가 종료된 경우
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * 루프 종료 요청. 실행 중인 작업이 끝나면 스레드가 종료되고 남은 작업은 버려집니다.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 종료 여부.
     *
     * @return shutdown이 요청되었으면 true
     */
    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * 스레드 종료 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 시간 안에 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    @Override
    public void dispose() {
        shutdown();
    }

    private void runLoop() {
        try {
            while (true) {
                Runnable task = nextTask();
                if (task == null) {
                    return;
                }
                runSafely(task);
            }
        } finally {
            int discarded = discardPending();
            log.info("Event loop stopped (thread: {}, discarded: {})", config.threadName(), discarded);
            terminated.countDown();
        }
    }

    private Runnable nextTask() {
        lock.lock();
        try {
            while (!shutdown) {
                Runnable microtask = microtasks.poll();
                if (microtask != null) {
                    return microtask;
                }
                long now = now();
                Timer next = timers.peek();
                if (next != null && next.deadline <= now) {
                    timers.poll();
                    return next.task;
                }
                if (!idleRequests.isEmpty()) {
                    List<IdleRequest> batch = new ArrayList<>(idleRequests);
                    idleRequests.clear();
                    return () -> runIdle(batch);
                }
                if (next == null) {
                    wakeup.await();
                } else {
                    wakeup.await(next.deadline - now, TimeUnit.MILLISECONDS);
                }
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown = true;
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void runIdle(List<IdleRequest> batch) {
        for (IdleRequest request : batch) {
            IdleDeadline deadline = new IdleDeadline(false, now() + config.idleBudgetMs(), this::now);
            runSafely(() -> request.callback.accept(deadline));
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Event loop task failed (thread: {})", config.threadName(), e);
        }
    }

    private void removeTimer(Timer timer) {
        lock.lock();
        try {
            timers.remove(timer);
        } finally {
            lock.unlock();
        }
    }

    private void removeIdleRequest(IdleRequest request) {
        lock.lock();
        try {
            idleRequests.remove(request);
        } finally {
            lock.unlock();
        }
    }

    private int discardPending() {
        lock.lock();
        try {
            shutdown = true;
            int count = timers.size() + microtasks.size() + idleRequests.size();
            timers.clear();
            microtasks.clear();
            idleRequests.clear();
            return count;
        } finally {
            lock.unlock();
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
