package com.ryuqq.cadence.async;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 결과를 만드는 작업.
 *
 * <p>동기적으로 던진 예외는 실패한 결과와 동일하게 취급됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Cadence Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncTask<T> {

    /**
     * 작업 시작.
     *
     * @return 작업 결과
     * @throws Exception 작업 시작 실패 시
     */
    CompletionStage<T> run() throws Exception;
}
