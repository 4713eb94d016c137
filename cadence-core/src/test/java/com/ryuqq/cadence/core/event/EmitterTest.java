package com.ryuqq.cadence.core.event;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.lifecycle.DisposableStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Emitter 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>구독 함수 메모이제이션과 구독 해제</li>
 *   <li>발행 시 스냅샷 사용</li>
 *   <li>리스너 예외 격리: 인스턴스 처리기 &gt; 전역 처리기, 항상 ERROR 로그</li>
 *   <li>생명주기 훅 호출 시점</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EmitterTest {

    @Mock
    private Consumer<String> listener;

    @Mock
    private EmitterErrorHandler globalHandler;

    private Logger emitterLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        emitterLogger = (Logger) LoggerFactory.getLogger(Emitter.class);
        appender = new ListAppender<>();
        appender.start();
        emitterLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        emitterLogger.detachAppender(appender);
        Emitter.setGlobalErrorHandler(null);
    }

    // ============================================================
    // 1. 구독 / 발행
    // ============================================================

    @Test
    void event_매번_같은_구독_함수를_반환함() {
        Emitter<String> emitter = new Emitter<>();

        assertThat(emitter.event()).isSameAs(emitter.event());
    }

    @Test
    void fire_구독_순서대로_리스너를_호출함() {
        // given
        Emitter<String> emitter = new Emitter<>();
        List<String> trace = new ArrayList<>();
        emitter.event().subscribe(value -> trace.add("first:" + value));
        emitter.event().subscribe(value -> trace.add("second:" + value));

        // when
        emitter.fire("x");

        // then
        assertThat(trace).containsExactly("first:x", "second:x");
    }

    @Test
    void subscribe_해제하면_그_리스너만_제거됨() {
        // given
        Emitter<String> emitter = new Emitter<>();
        List<String> trace = new ArrayList<>();
        Disposable first = emitter.event().subscribe(value -> trace.add("first"));
        emitter.event().subscribe(value -> trace.add("second"));

        // when
        first.dispose();
        emitter.fire("x");

        // then
        assertThat(trace).containsExactly("second");
    }

    @Test
    void fire_발행_중_추가된_리스너는_이번_발행에서_호출되지_않음() {
        // given
        Emitter<String> emitter = new Emitter<>();
        emitter.event().subscribe(value -> emitter.event().subscribe(listener));

        // when
        emitter.fire("first");

        // then
        verify(listener, never()).accept(any());
    }

    @Test
    void subscribe_저장소_오버로드는_구독을_저장소에_등록함() {
        // given
        Emitter<String> emitter = new Emitter<>();
        DisposableStore store = new DisposableStore();
        emitter.event().subscribe(listener, store);

        // when
        store.dispose();
        emitter.fire("x");

        // then
        verify(listener, never()).accept(any());
        assertThat(emitter.hasListeners()).isFalse();
    }

    @Test
    void dispose_후에는_발행과_구독이_무시됨() {
        // given
        Emitter<String> emitter = new Emitter<>();
        emitter.event().subscribe(listener);

        // when
        emitter.dispose();
        emitter.fire("x");
        Disposable late = emitter.event().subscribe(listener);

        // then
        verify(listener, never()).accept(any());
        assertThat(late).isSameAs(Disposable.NONE);
        assertThat(emitter.hasListeners()).isFalse();
    }

    // ============================================================
    // 2. 리스너 예외
    // ============================================================

    @Test
    void fire_리스너_예외는_격리되고_다른_리스너는_계속_호출됨() {
        // given
        Emitter<String> emitter = new Emitter<>();
        emitter.event().subscribe(value -> {
            throw new IllegalStateException("boom");
        });
        emitter.event().subscribe(listener);

        // when & then
        assertThatCode(() -> emitter.fire("x")).doesNotThrowAnyException();
        verify(listener).accept("x");
        assertThat(errorMessages()).containsExactly("Listener threw error");
    }

    @Test
    void fire_리스너가_Error를_던져도_격리되고_처리기에_전달됨() {
        // given
        List<Throwable> handled = new ArrayList<>();
        Emitter<String> emitter = new Emitter<>(new EmitterOptions()
            .withOnListenerError((error, value) -> handled.add(error)));
        AssertionError failure = new AssertionError("listener assertion");
        emitter.event().subscribe(value -> {
            throw failure;
        });
        emitter.event().subscribe(listener);

        // when & then
        assertThatCode(() -> emitter.fire("x")).doesNotThrowAnyException();
        verify(listener).accept("x");
        assertThat(handled).containsExactly(failure);
        assertThat(errorMessages()).containsExactly("Listener threw error");
    }

    @Test
    void fire_인스턴스_처리기가_있으면_전역_처리기보다_우선함() {
        // given
        Emitter.setGlobalErrorHandler(globalHandler);
        List<Throwable> handled = new ArrayList<>();
        Emitter<String> emitter = new Emitter<>(new EmitterOptions()
            .withOnListenerError((error, value) -> handled.add(error)));
        IllegalStateException failure = new IllegalStateException("boom");
        emitter.event().subscribe(value -> {
            throw failure;
        });

        // when
        emitter.fire("x");

        // then
        assertThat(handled).containsExactly(failure);
        verify(globalHandler, never()).handle(any(), any(), any());
        assertThat(errorMessages()).containsExactly("Listener threw error");
    }

    @Test
    void fire_인스턴스_처리기가_없으면_전역_처리기를_호출함() {
        // given
        Emitter.setGlobalErrorHandler(globalHandler);
        Emitter<String> emitter = new Emitter<>();
        IllegalStateException failure = new IllegalStateException("boom");
        emitter.event().subscribe(value -> {
            throw failure;
        });

        // when
        emitter.fire("x");

        // then
        verify(globalHandler).handle(same(emitter), same(failure), eq("x"));
    }

    @Test
    void fire_처리기가_예외를_던지면_로그하고_계속_진행함() {
        // given
        Emitter<String> emitter = new Emitter<>(new EmitterOptions()
            .withOnListenerError((error, value) -> {
                throw new IllegalArgumentException("handler failed");
            }));
        emitter.event().subscribe(value -> {
            throw new IllegalStateException("boom");
        });
        emitter.event().subscribe(listener);

        // when
        emitter.fire("x");

        // then
        verify(listener).accept("x");
        assertThat(errorMessages()).containsExactly("Error in listener error handler", "Listener threw error");
    }

    // ============================================================
    // 3. 생명주기 훅
    // ============================================================

    @Test
    void 훅은_첫_리스너_추가와_마지막_리스너_제거_시점에_호출됨() {
        // given
        List<String> trace = new ArrayList<>();
        Emitter<String> emitter = new Emitter<>(new EmitterOptions()
            .withOnWillAddFirstListener(() -> trace.add("willAddFirst"))
            .withOnDidAddFirstListener(() -> trace.add("didAddFirst"))
            .withOnWillRemoveListener(() -> trace.add("willRemove"))
            .withOnDidRemoveLastListener(() -> trace.add("didRemoveLast")));

        // when
        Disposable first = emitter.event().subscribe(value -> { });
        Disposable second = emitter.event().subscribe(value -> { });
        first.dispose();
        first.dispose();
        second.dispose();

        // then
        assertThat(trace).containsExactly(
            "willAddFirst", "didAddFirst",
            "willRemove",
            "willRemove", "didRemoveLast");
    }

    private List<String> errorMessages() {
        return appender.list.stream()
            .filter(event -> event.getLevel() == Level.ERROR)
            .map(ILoggingEvent::getFormattedMessage)
            .toList();
    }
}
