package com.ryuqq.cadence.async;

import com.ryuqq.cadence.core.cancellation.CancellationToken;

import java.util.concurrent.CompletionStage;

/**
 * 취소 토큰을 받는 비동기 작업.
 *
 * @param <T> 결과 타입
 * @author Cadence Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellableTask<T> {

    /**
     * 작업 시작.
     *
     * @param token 작업이 관찰해야 하는 취소 토큰
     * @return 작업 결과
     * @throws Exception 작업 시작 실패 시
     */
    CompletionStage<T> run(CancellationToken token) throws Exception;
}
