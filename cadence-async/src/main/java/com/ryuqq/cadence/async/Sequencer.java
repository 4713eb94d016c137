package com.ryuqq.cadence.async;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * 작업을 요청 순서대로 하나씩 실행.
 *
 * <p>앞선 작업이 실패해도 다음 작업은 실행됩니다. 실패한 작업의 예외는 그 작업을 요청한
 * 호출자에게만 전달됩니다.</p>
 *
 * <p>대기 작업은 반복문으로 꺼내 실행하므로, 즉시 완료되는 작업이 아무리 많이 쌓여 있어도
 * 호출 스택이 깊어지지 않습니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class Sequencer {

    private final Deque<Runnable> pending = new ArrayDeque<>();
    private boolean running;
    private boolean draining;

    /**
     * 작업을 체인 끝에 추가.
     *
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws IllegalArgumentException task가 null인 경우
     */
    public <T> CompletableFuture<T> queue(AsyncTask<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        pending.add(() -> start(task, result));
        drain();
        return result;
    }

    private <T> void start(AsyncTask<T> task, CompletableFuture<T> result) {
        running = true;
        Futures.invoke(task).whenComplete((value, error) -> {
            running = false;
            Futures.settle(result, value, error);
            drain();
        });
    }

    private void drain() {
        // 작업 완료 콜백에서 재진입하면 바깥 반복문이 이어서 처리
        if (draining) {
            return;
        }
        draining = true;
        try {
            while (!running && !pending.isEmpty()) {
                pending.poll().run();
            }
        } finally {
            draining = false;
        }
    }
}
