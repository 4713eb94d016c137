package com.ryuqq.cadence.core.result;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * @param error 오류 값
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public record Err<T, E>(E error) implements Result<T, E> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Err {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return (Result<U, E>) this;
    }

    @Override
    public <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper) {
        return new Err<>(mapper.apply(error));
    }

    /**
     * 실패 결과에서는 항상 예외를 던집니다.
     *
     * @throws IllegalStateException 항상 (오류 값이 Throwable이면 cause로 연결)
     */
    @Override
    public T unwrap() {
        if (error instanceof Throwable cause) {
            throw new IllegalStateException("unwrap called on Err: " + cause.getMessage(), cause);
        }
        throw new IllegalStateException("unwrap called on Err: " + error);
    }

    @Override
    public T unwrapOr(T defaultValue) {
        return defaultValue;
    }
}
