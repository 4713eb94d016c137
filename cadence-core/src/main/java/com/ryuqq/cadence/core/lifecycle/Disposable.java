package com.ryuqq.cadence.core.lifecycle;

/**
 * 해제 가능한 리소스.
 *
 * <p>이벤트 리스너 구독, 타이머, 취소 소스 등 수명이 있는 모든 리소스는
 * 단 하나의 해제 연산 {@link #dispose()}를 노출합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>멱등성: 여러 번 호출해도 두 번째 호출부터는 아무 일도 하지 않습니다.</li>
 *   <li>호출자에게 예외를 던지지 않습니다. 사용자 콜백을 감싸는 구현은
 *       {@link DisposableStore}처럼 예외를 격리해야 합니다.</li>
 * </ul>
 *
 * <p>{@link AutoCloseable}을 확장하므로 try-with-resources에서도 사용할 수 있습니다.</p>
 *
 * <pre>{@code
 * try (Disposable subscription = emitter.event().subscribe(this::onChange)) {
 *     // ...
 * }
 * }</pre>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Disposable extends AutoCloseable {

    /**
     * 아무 일도 하지 않는 공유 인스턴스.
     */
    Disposable NONE = () -> { };

    /**
     * 리소스 해제.
     */
    void dispose();

    /**
     * {@link #dispose()}에 위임합니다.
     */
    @Override
    default void close() {
        dispose();
    }
}
