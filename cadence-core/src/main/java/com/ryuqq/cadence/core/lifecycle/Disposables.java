package com.ryuqq.cadence.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link Disposable} 생성 및 조합 유틸리티.
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class Disposables {

    private static final Logger log = LoggerFactory.getLogger(Disposables.class);

    private Disposables() {
    }

    /**
     * 해제 동작을 Disposable로 변환.
     *
     * <p>반환된 Disposable은 멱등합니다. 동작은 최대 한 번만 실행됩니다.</p>
     *
     * @param action 해제 시 실행할 동작
     * @return Disposable
     * @throws IllegalArgumentException action이 null인 경우
     */
    public static Disposable toDisposable(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return new OnceDisposable(action);
    }

    /**
     * 여러 Disposable을 하나로 묶습니다.
     *
     * <p>일부 항목의 해제가 실패해도 나머지를 모두 해제하고, 실패는 모아서 로그로 남깁니다.</p>
     *
     * @param disposables 묶을 항목들
     * @return 묶음 Disposable
     */
    public static Disposable combine(Disposable... disposables) {
        List<Disposable> items = new ArrayList<>(Arrays.asList(disposables));
        return new OnceDisposable(() -> {
            List<Throwable> errors = new ArrayList<>();
            for (Disposable d : items) {
                try {
                    d.dispose();
                } catch (RuntimeException | Error e) {
                    errors.add(e);
                }
            }
            if (!errors.isEmpty()) {
                log.error("{} error(s) during combined dispose", errors.size(), new DisposalException(errors));
            }
        });
    }

    /**
     * Disposable 여부 확인.
     *
     * @param candidate 검사할 객체
     * @return Disposable이면 true
     */
    public static boolean isDisposable(Object candidate) {
        return candidate instanceof Disposable;
    }

    private static final class OnceDisposable implements Disposable {

        private Runnable action;

        OnceDisposable(Runnable action) {
            this.action = action;
        }

        @Override
        public void dispose() {
            Runnable toRun = action;
            if (toRun == null) {
                return;
            }
            action = null;
            toRun.run();
        }
    }
}
