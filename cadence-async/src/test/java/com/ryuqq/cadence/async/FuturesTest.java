package com.ryuqq.cadence.async;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Futures 유틸리티 테스트.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
class FuturesTest {

    @Test
    void invoke_동기_예외를_실패한_future로_바꿈() {
        IllegalStateException failure = new IllegalStateException("sync");

        CompletableFuture<String> result = Futures.invoke(() -> {
            throw failure;
        });

        assertThatThrownBy(result::join).hasCauseReference(failure);
    }

    @Test
    void invoke_null_반환은_실패로_취급함() {
        CompletableFuture<String> result = Futures.invoke(() -> null);

        assertThatThrownBy(result::join)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("task returned null");
    }

    @Test
    void forward_CompletionException_래퍼를_벗겨_전달함() {
        // given
        IllegalArgumentException failure = new IllegalArgumentException("inner");
        CompletableFuture<String> source = CompletableFuture.<String>failedFuture(failure)
            .thenApply(value -> value + "!");
        CompletableFuture<String> target = new CompletableFuture<>();

        // when
        Futures.forward(source, target);

        // then
        assertThatThrownBy(target::join).hasCauseReference(failure);
    }

    @Test
    void unwrap_중첩된_래퍼를_모두_제거함() {
        IllegalStateException root = new IllegalStateException("root");

        Throwable unwrapped = Futures.unwrap(new CompletionException(new CompletionException(root)));

        assertThat(unwrapped).isSameAs(root);
    }
}
