package com.ryuqq.cadence.async;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 키별로 독립된 순차 실행 체인.
 *
 * <p>같은 키의 작업은 요청 순서대로 실행되고, 다른 키의 작업은 서로 기다리지 않습니다.
 * 체인의 마지막 작업이 끝나면 키 항목이 제거됩니다. 그 사이 더 새로운 작업이 같은 키에
 * 추가되었다면 항목은 유지됩니다.</p>
 *
 * @param <K> 키 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public class SequencerByKey<K> {

    private final Map<K, Chain> chains = new LinkedHashMap<>();

    /**
     * 키의 체인 끝에 작업 추가.
     *
     * @param key 키
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws IllegalArgumentException key 또는 task가 null인 경우
     */
    public <T> CompletableFuture<T> queue(K key, AsyncTask<T> task) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        Chain chain = chains.computeIfAbsent(key, ignored -> new Chain());
        CompletableFuture<T> result = new CompletableFuture<>();
        chain.last = result;
        chain.pending.add(() -> start(key, chain, task, result));
        drain(chain);
        return result;
    }

    /**
     * 키의 현재 체인 끝 조회.
     *
     * @param key 키
     * @return 진행 중인 체인의 마지막 결과 (없으면 empty)
     */
    public Optional<CompletableFuture<?>> peek(K key) {
        Chain chain = chains.get(key);
        return chain == null ? Optional.empty() : Optional.of(chain.last);
    }

    /**
     * 진행 중인 키 목록.
     *
     * @return 키 스냅샷 (추가 순서)
     */
    public Set<K> keys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(chains.keySet()));
    }

    private <T> void start(K key, Chain chain, AsyncTask<T> task, CompletableFuture<T> result) {
        chain.running = true;
        Futures.invoke(task).whenComplete((value, error) -> {
            chain.running = false;
            if (chain.pending.isEmpty() && chains.get(key) == chain) {
                chains.remove(key);
            }
            Futures.settle(result, value, error);
            drain(chain);
        });
    }

    private void drain(Chain chain) {
        if (chain.draining) {
            return;
        }
        chain.draining = true;
        try {
            while (!chain.running && !chain.pending.isEmpty()) {
                chain.pending.poll().run();
            }
        } finally {
            chain.draining = false;
        }
    }

    private static final class Chain {
        private final Deque<Runnable> pending = new ArrayDeque<>();
        private CompletableFuture<?> last;
        private boolean running;
        private boolean draining;
    }
}
