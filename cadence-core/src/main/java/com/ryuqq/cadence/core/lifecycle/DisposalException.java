package com.ryuqq.cadence.core.lifecycle;

import java.util.List;

/**
 * 일괄 해제 중 발생한 예외 묶음.
 *
 * <p>{@link DisposableStore#clear()}와 {@link Disposables#combine(Disposable...)}은
 * 개별 해제 실패를 즉시 던지지 않고 모두 수집한 뒤, 이 예외 하나에
 * {@link #getSuppressed() suppressed} 예외로 담아 로그로 보고합니다.</p>
 *
 * <p>호출자에게 던져지지 않고 로그 이벤트의 throwable로만 사용됩니다.</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class DisposalException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int failureCount;

    /**
     * 수집된 실패 목록으로 생성.
     *
     * @param failures 해제 중 발생한 예외 목록 (비어 있으면 안 됨)
     * @throws IllegalArgumentException failures가 null이거나 비어 있는 경우
     */
    public DisposalException(List<? extends Throwable> failures) {
        super(message(failures));
        this.failureCount = failures.size();
        for (Throwable failure : failures) {
            addSuppressed(failure);
        }
    }

    private static String message(List<? extends Throwable> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        return failures.size() + " error(s) during dispose";
    }

    /**
     * 실패한 해제 개수.
     *
     * @return 실패 개수 (1 이상)
     */
    public int getFailureCount() {
        return failureCount;
    }
}
