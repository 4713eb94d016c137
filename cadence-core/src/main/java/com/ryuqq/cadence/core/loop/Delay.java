package com.ryuqq.cadence.core.loop;

/**
 * 지연 방식.
 *
 * <p>고정 밀리초 지연 또는 마이크로태스크 단위 지연({@link #MICROTASK}) 중 하나입니다.
 * 마이크로태스크 지연은 현재 매크로태스크가 끝나자마자 실행되므로 같은 틱 안의
 * 동기 호출 폭주만 병합합니다.</p>
 *
 * @param millis 지연 시간 (밀리초, 마이크로태스크 지연이면 0)
 * @param microtask 마이크로태스크 지연 여부
 * @author Cadence Team
 * @since 1.0.0
 */
public record Delay(long millis, boolean microtask) {

    /**
     * 마이크로태스크 단위 지연.
     */
    public static final Delay MICROTASK = new Delay(0, true);

    /**
     * 지연 없음 (다음 매크로태스크).
     */
    public static final Delay ZERO = new Delay(0, false);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException millis가 음수이거나, 마이크로태스크 지연에 millis가 지정된 경우
     */
    public Delay {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative (current: " + millis + ")");
        }
        if (microtask && millis != 0) {
            throw new IllegalArgumentException("microtask delay cannot carry millis (current: " + millis + ")");
        }
    }

    /**
     * 고정 밀리초 지연 생성.
     *
     * @param millis 지연 시간 (0 이상)
     * @return Delay
     */
    public static Delay ofMillis(long millis) {
        return new Delay(millis, false);
    }

    /**
     * 마이크로태스크 지연 여부.
     *
     * @return 마이크로태스크 지연이면 true
     */
    public boolean isMicrotask() {
        return microtask;
    }

    @Override
    public String toString() {
        return microtask ? "Delay[microtask]" : "Delay[" + millis + "ms]";
    }
}
