package com.ryuqq.cadence.core.result;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * 성공 값 또는 오류 값을 담는 결과 타입.
 *
 * <p>Result는 두 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 값</li>
 *   <li>{@link Err}: 오류 값</li>
 * </ul>
 *
 * <p>예외를 던지는 대신 값으로 실패를 돌려주어, 호출자가 실패 처리를 건너뛰지 못하게 합니다.</p>
 *
 * <pre>{@code
 * Result<Config, Throwable> loaded = Result.resultify(ConfigParser::parse).apply(text);
 * Config config = loaded.unwrapOr(Config.defaults());
 * }</pre>
 *
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 * @author Cadence Team
 * @since 1.0.0
 */
public sealed interface Result<T, E> permits Ok, Err {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Ok
     */
    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류 값
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Err
     */
    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    /**
     * 성공 여부.
     *
     * @return 성공이면 true
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 실패 여부.
     *
     * @return 실패이면 true
     */
    default boolean isErr() {
        return this instanceof Err;
    }

    /**
     * 성공 값 변환. 실패는 그대로 전달됩니다.
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    <U> Result<U, E> map(Function<? super T, ? extends U> mapper);

    /**
     * 오류 값 변환. 성공은 그대로 전달됩니다.
     *
     * @param mapper 변환 함수
     * @param <F> 변환 후 오류 타입
     * @return 변환된 Result
     */
    <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper);

    /**
     * 성공 값 조회.
     *
     * @return 성공 값
     * @throws IllegalStateException 실패 결과인 경우
     */
    T unwrap();

    /**
     * 성공 값 조회, 실패면 기본값.
     *
     * @param defaultValue 기본값
     * @return 성공 값 또는 기본값
     */
    T unwrapOr(T defaultValue);

    /**
     * 비동기 결과를 Result로 변환합니다. 반환된 future는 실패하지 않습니다.
     *
     * <p>{@link CompletionException} 래퍼는 벗겨낸 원래 예외를 Err에 담습니다.</p>
     *
     * @param stage 비동기 결과
     * @param <T> 성공 값 타입
     * @return Result로 완료되는 future
     */
    static <T> CompletableFuture<Result<T, Throwable>> tryCatch(CompletionStage<T> stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        CompletableFuture<Result<T, Throwable>> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(ok(value));
            } else {
                result.complete(err(unwrapCompletion(error)));
            }
        });
        return result;
    }

    /**
     * 예외를 던질 수 있는 함수를 Result를 돌려주는 함수로 변환.
     *
     * @param fn 원래 함수
     * @param <A> 인자 타입
     * @param <T> 성공 값 타입
     * @return Result를 돌려주는 함수
     */
    static <A, T> Function<A, Result<T, Throwable>> resultify(Function<? super A, ? extends T> fn) {
        if (fn == null) {
            throw new IllegalArgumentException("fn cannot be null");
        }
        return argument -> {
            try {
                return ok(fn.apply(argument));
            } catch (RuntimeException e) {
                return err(e);
            }
        };
    }

    private static Throwable unwrapCompletion(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
