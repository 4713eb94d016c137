package com.ryuqq.cadence.core.event;

import com.ryuqq.cadence.core.lifecycle.Disposable;
import com.ryuqq.cadence.core.lifecycle.DisposableStore;
import com.ryuqq.cadence.core.lifecycle.Disposables;
import com.ryuqq.cadence.core.loop.EventLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * {@link Event} 조합자 모음.
 *
 * <p>조합자는 기존 Event로부터 새 Event를 만듭니다. 별도 언급이 없으면 상류 구독은
 * 하류 리스너가 붙을 때 만들어지고 하류 구독이 해제될 때 함께 해제됩니다 (lazy).</p>
 *
 * <p>{@link DisposableStore}를 받는 오버로드는 즉시 상류를 구독하는 Emitter를 만들고,
 * 그 Emitter와 상류 구독을 저장소에 등록합니다 (eager).</p>
 *
 * @author Cadence Team
 * @since 1.0.0
 */
public final class Events {

    private static final Event<Object> NONE = listener -> Disposable.NONE;

    private Events() {
    }

    /**
     * 절대 발생하지 않는 Event.
     *
     * @param <T> 이벤트 값 타입
     * @return 빈 Event
     */
    @SuppressWarnings("unchecked")
    public static <T> Event<T> none() {
        return (Event<T>) NONE;
    }

    /**
     * 첫 번째 발생만 전달하는 Event.
     *
     * <p>리스너 안에서 상류가 동기적으로 다시 발생해도 두 번 전달하지 않습니다.</p>
     *
     * @param event 상류 Event
     * @param <T> 이벤트 값 타입
     * @return 한 번만 발생하는 Event
     */
    public static <T> Event<T> once(Event<T> event) {
        requireEvent(event);
        return listener -> {
            OnceSubscription<T> once = new OnceSubscription<>();
            once.subscription = event.subscribe(value -> {
                if (once.didFire) {
                    return;
                }
                once.didFire = true;
                if (once.subscription != null) {
                    once.subscription.dispose();
                }
                listener.accept(value);
            });
            if (once.didFire) {
                once.subscription.dispose();
            }
            return once.subscription;
        };
    }

    /**
     * 이벤트 값 변환.
     *
     * @param event 상류 Event
     * @param mapper 변환 함수
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     * @return 변환된 Event
     */
    public static <I, O> Event<O> map(Event<I> event, Function<? super I, ? extends O> mapper) {
        requireEvent(event);
        requireNonNull(mapper, "mapper");
        return listener -> event.subscribe(value -> listener.accept(mapper.apply(value)));
    }

    /**
     * 이벤트 값 변환 (즉시 구독).
     *
     * @param event 상류 Event
     * @param mapper 변환 함수
     * @param store Emitter와 상류 구독을 소유할 저장소
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     * @return 변환된 Event
     */
    public static <I, O> Event<O> map(Event<I> event, Function<? super I, ? extends O> mapper, DisposableStore store) {
        requireEvent(event);
        requireNonNull(mapper, "mapper");
        requireNonNull(store, "store");
        Emitter<O> emitter = new Emitter<>();
        Disposable subscription = event.subscribe(value -> emitter.fire(mapper.apply(value)));
        store.add(emitter);
        store.add(subscription);
        return emitter.event();
    }

    /**
     * 조건을 만족하는 이벤트만 전달.
     *
     * @param event 상류 Event
     * @param predicate 통과 조건
     * @param <T> 이벤트 값 타입
     * @return 필터링된 Event
     */
    public static <T> Event<T> filter(Event<T> event, Predicate<? super T> predicate) {
        requireEvent(event);
        requireNonNull(predicate, "predicate");
        return listener -> event.subscribe(value -> {
            if (predicate.test(value)) {
                listener.accept(value);
            }
        });
    }

    /**
     * 조건을 만족하는 이벤트만 전달 (즉시 구독).
     *
     * @param event 상류 Event
     * @param predicate 통과 조건
     * @param store Emitter와 상류 구독을 소유할 저장소
     * @param <T> 이벤트 값 타입
     * @return 필터링된 Event
     */
    public static <T> Event<T> filter(Event<T> event, Predicate<? super T> predicate, DisposableStore store) {
        requireEvent(event);
        requireNonNull(predicate, "predicate");
        requireNonNull(store, "store");
        Emitter<T> emitter = new Emitter<>();
        Disposable subscription = event.subscribe(value -> {
            if (predicate.test(value)) {
                emitter.fire(value);
            }
        });
        store.add(emitter);
        store.add(subscription);
        return emitter.event();
    }

    /**
     * 여러 Event를 하나로 합칩니다.
     *
     * <p>반환된 구독을 해제하면 모든 상류 구독이 해제됩니다.</p>
     *
     * @param events 합칠 Event들
     * @param <T> 이벤트 값 타입
     * @return 합쳐진 Event
     */
    @SafeVarargs
    public static <T> Event<T> any(Event<? extends T>... events) {
        requireNonNull(events, "events");
        List<Event<? extends T>> sources = List.of(events);
        return listener -> {
            Disposable[] subscriptions = new Disposable[sources.size()];
            for (int i = 0; i < subscriptions.length; i++) {
                subscriptions[i] = sources.get(i).subscribe(listener);
            }
            return Disposables.combine(subscriptions);
        };
    }

    /**
     * 값을 버리고 발생 사실만 전달하는 Event.
     *
     * @param event 상류 Event
     * @return 신호 Event
     */
    public static Event<Void> signal(Event<?> event) {
        requireEvent(event);
        return listener -> event.subscribe(ignored -> listener.accept(null));
    }

    /**
     * 누적값을 매 이벤트마다 발행.
     *
     * <p>누적값은 반환된 Event의 모든 구독이 공유합니다.</p>
     *
     * @param event 상류 Event
     * @param merge 누적 함수 (이전 누적값, 현재 값)
     * @param initial 초기 누적값 (null 허용)
     * @param <I> 입력 타입
     * @param <O> 누적값 타입
     * @return 누적값 Event
     */
    public static <I, O> Event<O> reduce(Event<I> event, BiFunction<? super O, ? super I, ? extends O> merge, O initial) {
        requireNonNull(merge, "merge");
        return map(event, new Accumulator<I, O>(merge, initial));
    }

    /**
     * 누적값을 매 이벤트마다 발행 (즉시 구독).
     *
     * @param event 상류 Event
     * @param merge 누적 함수 (이전 누적값, 현재 값)
     * @param initial 초기 누적값 (null 허용)
     * @param store Emitter와 상류 구독을 소유할 저장소
     * @param <I> 입력 타입
     * @param <O> 누적값 타입
     * @return 누적값 Event
     */
    public static <I, O> Event<O> reduce(
            Event<I> event,
            BiFunction<? super O, ? super I, ? extends O> merge,
            O initial,
            DisposableStore store) {
        requireNonNull(merge, "merge");
        return map(event, new Accumulator<I, O>(merge, initial), store);
    }

    /**
     * 폭주를 하나의 누적값으로 병합해 발행.
     *
     * <p>각 상류 이벤트를 merge로 누적하고, delay 동안 조용하면 누적값을 발행합니다.
     * merge의 첫 인자는 폭주 시작 시 null입니다.</p>
     *
     * <ul>
     *   <li>leading: 대기 중인 타이머가 없으면 즉시 발행. 폭주가 그 한 건뿐이면 만료 시 다시 발행하지 않음</li>
     *   <li>{@link com.ryuqq.cadence.core.loop.Delay#MICROTASK}: 폭주당 마이크로태스크 하나만 예약</li>
     *   <li>flushOnListenerRemove: 리스너 제거 직전에 보류 중인 값을 발행하고 타이머 취소</li>
     * </ul>
     *
     * <p>상류 구독은 첫 리스너가 붙을 때 만들어지고, 마지막 리스너가 떨어질 때 타이머와 함께 해제됩니다.</p>
     *
     * @param event 상류 Event
     * @param merge 누적 함수
     * @param options debounce 설정
     * @param loop 타이머를 예약할 EventLoop
     * @param <I> 입력 타입
     * @param <O> 누적값 타입
     * @return debounce된 Event
     */
    public static <I, O> Event<O> debounce(
            Event<I> event,
            BiFunction<? super O, ? super I, ? extends O> merge,
            DebounceOptions options,
            EventLoop loop) {
        return Events.<I, O>newDebounce(event, merge, options, loop).event();
    }

    /**
     * 폭주를 하나의 누적값으로 병합해 발행 (Emitter를 저장소에 등록).
     *
     * @param event 상류 Event
     * @param merge 누적 함수
     * @param options debounce 설정
     * @param loop 타이머를 예약할 EventLoop
     * @param store Emitter를 소유할 저장소
     * @param <I> 입력 타입
     * @param <O> 누적값 타입
     * @return debounce된 Event
     */
    public static <I, O> Event<O> debounce(
            Event<I> event,
            BiFunction<? super O, ? super I, ? extends O> merge,
            DebounceOptions options,
            EventLoop loop,
            DisposableStore store) {
        requireNonNull(store, "store");
        return store.add(Events.<I, O>newDebounce(event, merge, options, loop)).event();
    }

    /**
     * 이벤트를 다음 매크로태스크로 미루고 신호로 변환.
     *
     * <p>같은 틱 안의 여러 발생은 하나로 합쳐집니다.</p>
     *
     * @param event 상류 Event
     * @param loop 타이머를 예약할 EventLoop
     * @param <T> 입력 타입
     * @return 신호 Event
     */
    public static <T> Event<Void> defer(Event<T> event, EventLoop loop) {
        return Events.<T, Void>debounce(event, (last, current) -> null, new DebounceOptions().withDelayMs(0), loop);
    }

    /**
     * 리스너가 붙기 전 발생한 이벤트를 버퍼링.
     *
     * @param event 상류 Event
     * @param loop 타이머를 예약할 EventLoop
     * @param <T> 이벤트 값 타입
     * @return 버퍼링 Event
     * @see #buffer(Event, boolean, List, EventLoop)
     */
    public static <T> Event<T> buffer(Event<T> event, EventLoop loop) {
        return buffer(event, false, List.of(), loop);
    }

    /**
     * 리스너가 붙기 전 발생한 이벤트를 버퍼링.
     *
     * <p>상류는 즉시 구독합니다. 첫 리스너가 붙으면 버퍼의 이벤트를 순서대로 재생하고,
     * 이후 이벤트는 바로 전달합니다.</p>
     *
     * <p>flushAfterTimeout이면 버퍼에 첫 항목이 들어올 때 지연 0 타이머를 예약해, 리스너가 없어도
     * 버퍼를 비웁니다. 마지막 리스너가 떨어진 뒤에는 타이머가 발행하지 않습니다.</p>
     *
     * @param event 상류 Event
     * @param flushAfterTimeout 타이머로 버퍼 비우기 여부
     * @param seed 초기 버퍼 내용
     * @param loop 타이머를 예약할 EventLoop
     * @param <T> 이벤트 값 타입
     * @return 버퍼링 Event
     */
    public static <T> Event<T> buffer(Event<T> event, boolean flushAfterTimeout, List<? extends T> seed, EventLoop loop) {
        return newBuffer(event, flushAfterTimeout, seed, loop, null).event();
    }

    /**
     * 리스너가 붙기 전 발생한 이벤트를 버퍼링 (Emitter를 저장소에 등록).
     *
     * @param event 상류 Event
     * @param flushAfterTimeout 타이머로 버퍼 비우기 여부
     * @param seed 초기 버퍼 내용
     * @param loop 타이머를 예약할 EventLoop
     * @param store Emitter를 소유할 저장소
     * @param <T> 이벤트 값 타입
     * @return 버퍼링 Event
     */
    public static <T> Event<T> buffer(
            Event<T> event,
            boolean flushAfterTimeout,
            List<? extends T> seed,
            EventLoop loop,
            DisposableStore store) {
        requireNonNull(store, "store");
        return newBuffer(event, flushAfterTimeout, seed, loop, store).event();
    }

    /**
     * 조건을 만족하는 첫 이벤트만 전달.
     *
     * @param event 상류 Event
     * @param predicate 조건
     * @param <T> 이벤트 값 타입
     * @return 한 번만 발생하는 Event
     */
    public static <T> Event<T> onceIf(Event<T> event, Predicate<? super T> predicate) {
        return once(filter(event, predicate));
    }

    /**
     * 최대 대기 시간이 있는 debounce.
     *
     * <p>{@link #debounce}와 독립된 구현입니다. 상태는 구독마다 따로 가지며, 마지막 이벤트 후
     * delayMs 동안 조용하면 발행하고, maxWaitMs가 설정되면 폭주의 첫 이벤트부터 maxWaitMs가
     * 지났을 때 강제로 발행합니다. 구독을 해제하면 두 타이머가 모두 취소됩니다.</p>
     *
     * @param event 상류 Event
     * @param merge 누적 함수 (이전 누적값은 폭주 시작 시 null)
     * @param options 지연 설정
     * @param loop 타이머를 예약할 EventLoop
     * @param <I> 입력 타입
     * @param <O> 누적값 타입
     * @return debounce된 Event
     */
    public static <I, O> Event<O> debounceWithMaxWait(
            Event<I> event,
            BiFunction<? super O, ? super I, ? extends O> merge,
            MaxWaitDebounceOptions options,
            EventLoop loop) {
        requireEvent(event);
        requireNonNull(merge, "merge");
        requireNonNull(options, "options");
        requireNonNull(loop, "loop");
        return listener -> {
            MaxWaitDebouncer<I, O> debouncer = new MaxWaitDebouncer<>(merge, options, loop, listener);
            Disposable upstream = event.subscribe(debouncer::onEvent);
            return Disposables.toDisposable(() -> {
                upstream.dispose();
                debouncer.cancelTimers();
            });
        };
    }

    private static <I, O> Emitter<O> newDebounce(
            Event<I> event,
            BiFunction<? super O, ? super I, ? extends O> merge,
            DebounceOptions options,
            EventLoop loop) {
        Debouncer<I, O> debouncer = new Debouncer<>(event, merge, options, loop);
        Emitter<O> emitter = new Emitter<>(new EmitterOptions()
                .withOnWillAddFirstListener(debouncer::attach)
                .withOnWillRemoveListener(debouncer::onWillRemoveListener)
                .withOnDidRemoveLastListener(debouncer::detach));
        debouncer.emitter = emitter;
        return emitter;
    }

    private static <T> Emitter<T> newBuffer(
            Event<T> event,
            boolean flushAfterTimeout,
            List<? extends T> seed,
            EventLoop loop,
            DisposableStore owner) {
        requireEvent(event);
        requireNonNull(seed, "seed");
        requireNonNull(loop, "loop");
        Buffer<T> buffer = new Buffer<>(event, flushAfterTimeout, seed, loop);
        Emitter<T> emitter = new Emitter<>(new EmitterOptions()
                .withOnWillAddFirstListener(buffer::attach)
                .withOnDidAddFirstListener(buffer::replay)
                .withOnDidRemoveLastListener(buffer::detach));
        buffer.start(emitter);
        if (owner != null) {
            // 상류는 즉시 구독되므로 리스너가 없어도 저장소 해제 시 함께 해제
            owner.add(emitter);
            owner.add(Disposables.toDisposable(buffer::detach));
        }
        return emitter;
    }

    private static void requireEvent(Event<?> event) {
        requireNonNull(event, "event");
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static final class OnceSubscription<T> {
        private Disposable subscription;
        private boolean didFire;
    }

    private static final class Accumulator<I, O> implements Function<I, O> {

        private final BiFunction<? super O, ? super I, ? extends O> merge;
        private O output;

        private Accumulator(BiFunction<? super O, ? super I, ? extends O> merge, O initial) {
            this.merge = merge;
            this.output = initial;
        }

        @Override
        public O apply(I value) {
            output = merge.apply(output, value);
            return output;
        }
    }

    /**
     * debounce 상태. 반환된 Event의 모든 구독이 공유합니다.
     */
    private static final class Debouncer<I, O> {

        private final Event<I> event;
        private final BiFunction<? super O, ? super I, ? extends O> merge;
        private final DebounceOptions options;
        private final EventLoop loop;

        private Emitter<O> emitter;
        private Disposable subscription;
        private Disposable handle;
        private boolean pending;
        private O output;
        private int debouncedCalls;

        private Debouncer(Event<I> event, BiFunction<? super O, ? super I, ? extends O> merge, DebounceOptions options, EventLoop loop) {
            requireEvent(event);
            requireNonNull(merge, "merge");
            requireNonNull(options, "options");
            requireNonNull(loop, "loop");
            this.event = event;
            this.merge = merge;
            this.options = options;
            this.loop = loop;
        }

        void attach() {
            subscription = event.subscribe(this::onEvent);
        }

        private void onEvent(I current) {
            debouncedCalls++;
            output = merge.apply(output, current);

            if (options.leading() && !pending) {
                O leadingValue = output;
                output = null;
                emitter.fire(leadingValue);
            }

            if (options.delay().isMicrotask()) {
                if (!pending) {
                    pending = true;
                    handle = loop.schedule(this::fire, options.delay());
                }
            } else {
                cancelHandle();
                pending = true;
                handle = loop.schedule(this::fire, options.delay());
            }
        }

        private void fire() {
            O value = output;
            output = null;
            pending = false;
            handle = null;
            int calls = debouncedCalls;
            debouncedCalls = 0;
            if (!options.leading() || calls > 1) {
                emitter.fire(value);
            }
        }

        void onWillRemoveListener() {
            if (options.flushOnListenerRemove() && debouncedCalls > 0) {
                cancelHandle();
                fire();
            }
        }

        void detach() {
            if (subscription != null) {
                subscription.dispose();
                subscription = null;
            }
            cancelHandle();
            pending = false;
            output = null;
            debouncedCalls = 0;
        }

        private void cancelHandle() {
            if (handle != null) {
                handle.dispose();
                handle = null;
            }
        }
    }

    /**
     * 구독별 최대 대기 debounce 상태.
     */
    private static final class MaxWaitDebouncer<I, O> {

        private final BiFunction<? super O, ? super I, ? extends O> merge;
        private final MaxWaitDebounceOptions options;
        private final EventLoop loop;
        private final Consumer<? super O> listener;

        private O merged;
        private boolean hasMerged;
        private Disposable timeout;
        private Disposable maxTimeout;

        private MaxWaitDebouncer(
                BiFunction<? super O, ? super I, ? extends O> merge,
                MaxWaitDebounceOptions options,
                EventLoop loop,
                Consumer<? super O> listener) {
            this.merge = merge;
            this.options = options;
            this.loop = loop;
            this.listener = listener;
        }

        void onEvent(I value) {
            merged = merge.apply(merged, value);
            hasMerged = true;

            if (timeout != null) {
                timeout.dispose();
            }
            timeout = loop.schedule(() -> {
                timeout = null;
                cancelMaxTimeout();
                flush();
            }, options.delayMs());

            if (options.hasMaxWait() && maxTimeout == null) {
                maxTimeout = loop.schedule(() -> {
                    maxTimeout = null;
                    if (timeout != null) {
                        timeout.dispose();
                        timeout = null;
                    }
                    flush();
                }, options.maxWaitMs());
            }
        }

        private void flush() {
            if (!hasMerged) {
                return;
            }
            O toFire = merged;
            merged = null;
            hasMerged = false;
            listener.accept(toFire);
        }

        void cancelTimers() {
            if (timeout != null) {
                timeout.dispose();
                timeout = null;
            }
            cancelMaxTimeout();
        }

        private void cancelMaxTimeout() {
            if (maxTimeout != null) {
                maxTimeout.dispose();
                maxTimeout = null;
            }
        }
    }

    /**
     * buffer 상태.
     */
    private static final class Buffer<T> {

        private final Event<T> event;
        private final boolean flushAfterTimeout;
        private final EventLoop loop;

        private Emitter<T> emitter;
        private List<T> buffered;
        private Disposable listener;
        private Disposable flushTimer;
        private boolean detached;

        private Buffer(Event<T> event, boolean flushAfterTimeout, List<? extends T> seed, EventLoop loop) {
            this.event = event;
            this.flushAfterTimeout = flushAfterTimeout;
            this.loop = loop;
            this.buffered = new ArrayList<>(seed);
        }

        void start(Emitter<T> emitter) {
            this.emitter = emitter;
            listener = event.subscribe(value -> {
                if (buffered != null) {
                    buffered.add(value);
                    scheduleFlush();
                } else {
                    emitter.fire(value);
                }
            });
            scheduleFlush();
        }

        private void scheduleFlush() {
            if (flushAfterTimeout && flushTimer == null && !detached && buffered != null && !buffered.isEmpty()) {
                flushTimer = loop.schedule(() -> {
                    flushTimer = null;
                    if (!detached && buffered != null) {
                        List<T> toFire = buffered;
                        buffered = null;
                        toFire.forEach(emitter::fire);
                    }
                }, 0);
            }
        }

        void attach() {
            if (listener == null) {
                listener = event.subscribe(emitter::fire);
            }
        }

        void replay() {
            cancelFlushTimer();
            if (buffered != null) {
                List<T> toFire = buffered;
                buffered = null;
                toFire.forEach(emitter::fire);
            }
        }

        void detach() {
            detached = true;
            if (listener != null) {
                listener.dispose();
                listener = null;
            }
            cancelFlushTimer();
        }

        private void cancelFlushTimer() {
            if (flushTimer != null) {
                flushTimer.dispose();
                flushTimer = null;
            }
        }
    }
}
