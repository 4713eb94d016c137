package com.ryuqq.cadence.core.cancellation;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 취소를 나타내는 예외.
 *
 * <p>취소는 예상된 결과이므로 실패로 로그하지 않습니다. 래핑된 예외도
 * {@link #isCancellationError(Throwable)}로 판별할 수 있습니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class CancellationError extends CancellationException {

    private static final long serialVersionUID = 1L;

    private static final String NAME = "CancellationError";

    /**
     * 기본 메시지("Cancelled")로 생성.
     */
    public CancellationError() {
        this("Cancelled");
    }

    /**
     * 메시지를 지정해 생성.
     *
     * @param message 메시지
     */
    public CancellationError(String message) {
        super(message);
    }

    /**
     * 취소 예외 여부 확인.
     *
     * <p>{@link CompletionException} / {@link ExecutionException} 래퍼를 벗겨낸 뒤,
     * 타입이 일치하거나 클래스 단순 이름이 {@code CancellationError}이면 true입니다.</p>
     *
     * @param error 검사할 예외
     * @return 취소 예외면 true
     */
    public static boolean isCancellationError(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current == null) {
            return false;
        }
        return current instanceof CancellationError || NAME.equals(current.getClass().getSimpleName());
    }
}
