package com.ryuqq.cadence.async;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * {@link CompletableFuture} 연결 유틸리티.
 *
 * <p>실패는 항상 {@link CompletionException} 래퍼를 벗겨 전달하므로, 호출자는 작업이 던진
 * 바로 그 예외 객체를 받습니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
    }

    /**
     * 작업 실행.
     *
     * <p>작업이 동기적으로 예외를 던지거나 null을 반환하면 실패한 future를 반환합니다.</p>
     *
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    public static <T> CompletableFuture<T> invoke(AsyncTask<T> task) {
        CompletionStage<T> stage;
        try {
            stage = task.run();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("task returned null"));
        }
        return stage.toCompletableFuture();
    }

    /**
     * source의 결과를 target에 전달.
     *
     * @param source 원본
     * @param target 대상
     * @param <T> 결과 타입
     */
    public static <T> void forward(CompletionStage<? extends T> source, CompletableFuture<T> target) {
        source.whenComplete((value, error) -> settle(target, value, error));
    }

    /**
     * 값 또는 예외로 target 완료.
     *
     * @param target 대상
     * @param value 값
     * @param error 예외 (null이면 성공)
     * @param <T> 결과 타입
     */
    public static <T> void settle(CompletableFuture<T> target, T value, Throwable error) {
        if (error != null) {
            target.completeExceptionally(unwrap(error));
        } else {
            target.complete(value);
        }
    }

    /**
     * {@link CompletionException} 래퍼 제거.
     *
     * @param error 예외
     * @return 원인 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
