package com.ryuqq.cadence.core.lifecycle;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * DisposableStore 유닛 테스트.
 *
 * <p>일괄 해제의 장애 격리와 로그 집계를 검증합니다:</p>
 * <ul>
 *   <li>k개 중 m개가 실패해도 k개 모두 해제, 호출자에게 예외 없음</li>
 *   <li>실패는 DisposalException 하나로 모아 ERROR 로그 한 번</li>
 *   <li>해제된 저장소에 추가하면 즉시 해제</li>
 *   <li>deleteAndDispose는 실패를 다시 던짐</li>
 * </ul>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DisposableStoreTest {

    private Logger storeLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        storeLogger = (Logger) LoggerFactory.getLogger(DisposableStore.class);
        appender = new ListAppender<>();
        appender.start();
        storeLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        storeLogger.detachAppender(appender);
    }

    // ============================================================
    // 1. 일괄 해제
    // ============================================================

    @Test
    void dispose_일부_항목이_실패해도_모두_해제하고_실패_수만큼_집계해_로그함() {
        // given
        DisposableStore store = new DisposableStore();
        List<Disposable> members = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Disposable member = mock(Disposable.class);
            if (i % 2 == 0) {
                doThrow(new IllegalStateException("boom-" + i)).when(member).dispose();
            }
            members.add(store.add(member));
        }

        // when
        assertThatCode(store::dispose).doesNotThrowAnyException();

        // then
        members.forEach(member -> verify(member).dispose());

        List<ILoggingEvent> errors = errorEvents();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getFormattedMessage()).isEqualTo("3 error(s) during DisposableStore dispose");

        Throwable logged = ((ThrowableProxy) errors.get(0).getThrowableProxy()).getThrowable();
        assertThat(logged).isInstanceOf(DisposalException.class);
        assertThat(((DisposalException) logged).getFailureCount()).isEqualTo(3);
        assertThat(logged.getSuppressed()).hasSize(3);
    }

    @Test
    void dispose_실패가_없으면_ERROR_로그를_남기지_않음() {
        // given
        DisposableStore store = new DisposableStore();
        store.add(mock(Disposable.class));
        store.add(mock(Disposable.class));

        // when
        store.dispose();

        // then
        assertThat(errorEvents()).isEmpty();
        assertThat(store.isDisposed()).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void dispose_여러_번_호출해도_항목은_한_번만_해제됨() {
        // given
        DisposableStore store = new DisposableStore();
        Disposable member = store.add(mock(Disposable.class));

        // when
        store.dispose();
        store.dispose();

        // then
        verify(member, times(1)).dispose();
    }

    @Test
    void clear_항목을_해제하지만_저장소는_계속_사용_가능함() {
        // given
        DisposableStore store = new DisposableStore();
        Disposable first = store.add(mock(Disposable.class));

        // when
        store.clear();
        Disposable second = store.add(mock(Disposable.class));

        // then
        verify(first).dispose();
        verify(second, never()).dispose();
        assertThat(store.isDisposed()).isFalse();
        assertThat(store.size()).isEqualTo(1);
    }

    // ============================================================
    // 2. 추가 / 분리
    // ============================================================

    @Test
    void add_추가한_항목을_그대로_반환함() {
        DisposableStore store = new DisposableStore();
        Disposable member = mock(Disposable.class);

        assertThat(store.add(member)).isSameAs(member);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void add_해제된_저장소에_추가하면_즉시_해제하고_경고함() {
        // given
        DisposableStore store = new DisposableStore();
        store.dispose();
        Disposable late = mock(Disposable.class);

        // when
        store.add(late);

        // then
        verify(late).dispose();
        assertThat(store.size()).isZero();
        assertThat(appender.list)
            .anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("disposed DisposableStore"));
    }

    @Test
    void add_자기_자신이나_null은_거부함() {
        DisposableStore store = new DisposableStore();

        assertThatThrownBy(() -> store.add(store))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("itself");
        assertThatThrownBy(() -> store.add(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("disposable cannot be null");
    }

    @Test
    void delete_분리만_하고_해제하지_않음() {
        // given
        DisposableStore store = new DisposableStore();
        Disposable member = store.add(mock(Disposable.class));

        // when
        store.delete(member);
        store.dispose();

        // then
        verify(member, never()).dispose();
    }

    @Test
    void deleteAndDispose_해제_실패를_로그하고_다시_던짐() {
        // given
        DisposableStore store = new DisposableStore();
        Disposable member = mock(Disposable.class);
        IllegalStateException failure = new IllegalStateException("boom");
        doThrow(failure).when(member).dispose();
        store.add(member);

        // when & then
        assertThatThrownBy(() -> store.deleteAndDispose(member)).isSameAs(failure);
        assertThat(store.size()).isZero();
        assertThat(errorEvents()).hasSize(1);
    }

    private List<ILoggingEvent> errorEvents() {
        return appender.list.stream()
            .filter(event -> event.getLevel() == Level.ERROR)
            .toList();
    }
}
