package com.ryuqq.cadence.core.result;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 허용)
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public record Ok<T, E>(T value) implements Result<T, E> {

    @Override
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return new Ok<>(mapper.apply(value));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper) {
        return (Result<T, F>) this;
    }

    @Override
    public T unwrap() {
        return value;
    }

    @Override
    public T unwrapOr(T defaultValue) {
        return value;
    }
}
