package com.ryuqq.cadence.core.cancellation;

import com.ryuqq.cadence.core.lifecycle.Disposable;

/**
 * {@link CancellationToken}을 생성하고 제어하는 Source.
 *
 * <p>토큰은 처음 {@link #token()}을 읽을 때 생성됩니다. 토큰이 만들어지기 전에
 * {@link #cancel()}이 호출되면 {@link CancellationToken#CANCELLED} 싱글톤을 사용합니다.</p>
 *
 * <p>부모 토큰을 지정하면 부모가 취소될 때 함께 취소됩니다. 생성 시점에 부모가 이미 취소된 상태면
 * 즉시 취소됩니다.</p>
 *
 * <pre>{@code
 * CancellationTokenSource source = new CancellationTokenSource();
 * CompletableFuture<Result> request = client.fetch(query, source.token());
 *
 * // 사용자가 취소 버튼을 누름
 * source.dispose(true);
 * }</pre>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public class CancellationTokenSource implements Disposable {

    private CancellationToken token;
    private Disposable parentListener;

    /**
     * 부모 없는 Source 생성.
     */
    public CancellationTokenSource() {
        this(null);
    }

    /**
     * 부모 토큰에 연결된 Source 생성.
     *
     * @param parent 부모 토큰 (null이면 독립)
     */
    public CancellationTokenSource(CancellationToken parent) {
        if (parent == null) {
            return;
        }
        if (parent.isCancellationRequested()) {
            cancel();
            return;
        }
        this.parentListener = parent.onCancellationRequested().subscribe(ignored -> cancel());
    }

    /**
     * 토큰 조회 (최초 호출 시 생성).
     *
     * @return 이 Source의 토큰
     */
    public CancellationToken token() {
        if (token == null) {
            token = new MutableToken();
        }
        return token;
    }

    /**
     * 취소 요청.
     *
     * <p>토큰의 취소 이벤트는 최초 호출에서만 발생합니다.</p>
     */
    public void cancel() {
        if (token instanceof MutableToken mutable) {
            mutable.cancel();
        } else if (token == null) {
            token = CancellationToken.CANCELLED;
        }
    }

    /**
     * 부모 구독과 토큰 Emitter를 해제합니다. 취소는 하지 않습니다.
     */
    @Override
    public void dispose() {
        dispose(false);
    }

    /**
     * 리소스 해제.
     *
     * @param cancelFirst true이면 해제 전에 취소 요청
     */
    public void dispose(boolean cancelFirst) {
        if (cancelFirst) {
            cancel();
        }
        if (parentListener != null) {
            parentListener.dispose();
            parentListener = null;
        }
        if (token instanceof MutableToken mutable) {
            mutable.dispose();
        }
    }
}
