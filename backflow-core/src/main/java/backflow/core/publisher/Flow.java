/*
 * Copyright (c) 2024-Present VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package backflow.core.publisher;

import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import backflow.core.Disposable;
import backflow.core.Exceptions;
import backflow.core.scheduler.Scheduler;
import backflow.core.scheduler.Schedulers;
import backflow.util.annotation.Nullable;
import backflow.util.function.Tuple2;

/**
 * A Reactive Streams {@link Publisher} with the backflow operators: 0 to N values,
 * then at most one terminal signal (completion or failure).
 * <p>
 * Every operator honors the subscriber's demand: values are buffered in a
 * {@link DemandBuffer}, never pushed beyond what was {@link org.reactivestreams.Subscription#request(long) requested}.
 * Cancelling a subscription cancels every upstream subscription the operator holds.
 *
 * @param <T> the element type of this Reactive Streams {@link Publisher}
 */
public abstract class Flow<T> implements Publisher<T> {

//	 ==============================================================================================================
//	 Static Generators
//	 ==============================================================================================================

	/**
	 * Pick the first {@link Publisher} to emit any signal (value or terminal) and
	 * relay it, cancelling the others.
	 * <p>
	 * Sources are combined by a left fold of pairwise races. When several sources
	 * signal at the same time exactly one of them wins.
	 *
	 * @param sources the competing sources
	 * @param <I> The type of values in both source and output sequences
	 * @return a new {@link Flow} behaving like the fastest of its sources
	 */
	@SafeVarargs
	public static <I> Flow<I> amb(Publisher<? extends I>... sources) {
		return amb(Arrays.asList(sources));
	}

	/**
	 * Pick the first {@link Publisher} to emit any signal (value or terminal) and
	 * relay it, cancelling the others. No source means an empty sequence.
	 *
	 * @param sources the competing sources
	 * @param <I> The type of values in both source and output sequences
	 * @return a new {@link Flow} behaving like the fastest of its sources
	 */
	public static <I> Flow<I> amb(Iterable<? extends Publisher<? extends I>> sources) {
		Iterator<? extends Publisher<? extends I>> it = Objects.requireNonNull(sources, "sources").iterator();
		if (!it.hasNext()) {
			return empty();
		}
		Flow<I> result = from(it.next());
		while (it.hasNext()) {
			result = new FlowAmb<>(result, it.next());
		}
		return result;
	}

	/**
	 * Lazily supply a {@link Publisher} every time a subscription is made.
	 *
	 * @param supplier the {@link Publisher} {@link Supplier} to call on subscribe
	 * @param <T> the type of values passing through the {@link Flow}
	 * @return a deferred {@link Flow}
	 */
	public static <T> Flow<T> defer(Supplier<? extends Publisher<? extends T>> supplier) {
		return new FlowDefer<>(supplier);
	}

	/**
	 * Emit {@code 0L} once the given delay has elapsed on the shared
	 * {@link Schedulers#timer() timer}, then complete.
	 *
	 * @param delay the delay
	 * @return a new {@link Flow}
	 */
	public static Flow<Long> delay(Duration delay) {
		return delay(delay, Schedulers.timer());
	}

	/**
	 * Emit {@code 0L} once the given delay has elapsed on the given {@link Scheduler},
	 * then complete.
	 *
	 * @param delay the delay
	 * @param timer the {@link Scheduler} the delay runs on
	 * @return a new {@link Flow}
	 */
	public static Flow<Long> delay(Duration delay, Scheduler timer) {
		return new FlowDelayed<>(0L, null, delay, timer);
	}

	/**
	 * Emit the given value once the delay has elapsed, then complete. The value waits
	 * for demand if none is outstanding at that time.
	 *
	 * @param data the value to emit
	 * @param delay the delay
	 * @param <T> the type of the value
	 * @return a new {@link Flow}
	 */
	public static <T> Flow<T> delayedJust(T data, Duration delay) {
		return delayedJust(data, delay, Schedulers.timer());
	}

	/**
	 * Emit the given value once the delay has elapsed on the given {@link Scheduler},
	 * then complete.
	 *
	 * @param data the value to emit
	 * @param delay the delay
	 * @param timer the {@link Scheduler} the delay runs on
	 * @param <T> the type of the value
	 * @return a new {@link Flow}
	 */
	public static <T> Flow<T> delayedJust(T data, Duration delay, Scheduler timer) {
		return new FlowDelayed<>(Objects.requireNonNull(data, "data"), null, delay, timer);
	}

	/**
	 * Fail with the given error once the delay has elapsed.
	 *
	 * @param error the failure to signal
	 * @param delay the delay
	 * @param <T> the reified type of the target {@link Subscriber}
	 * @return a new failing {@link Flow}
	 */
	public static <T> Flow<T> delayedError(Throwable error, Duration delay) {
		return delayedError(error, delay, Schedulers.timer());
	}

	/**
	 * Fail with the given error once the delay has elapsed on the given {@link Scheduler}.
	 *
	 * @param error the failure to signal
	 * @param delay the delay
	 * @param timer the {@link Scheduler} the delay runs on
	 * @param <T> the reified type of the target {@link Subscriber}
	 * @return a new failing {@link Flow}
	 */
	public static <T> Flow<T> delayedError(Throwable error, Duration delay, Scheduler timer) {
		return new FlowDelayed<>(null, Objects.requireNonNull(error, "error"), delay, timer);
	}

	/**
	 * Create a {@link Flow} that completes without emitting any item.
	 *
	 * @param <T> the reified type of the target {@link Subscriber}
	 * @return an empty {@link Flow}
	 */
	public static <T> Flow<T> empty() {
		return FlowEmpty.instance();
	}

	/**
	 * Create a {@link Flow} that terminates with the specified error immediately after
	 * being subscribed to.
	 *
	 * @param error the error to signal to each {@link Subscriber}
	 * @param <T> the reified type of the target {@link Subscriber}
	 * @return a new failing {@link Flow}
	 */
	public static <T> Flow<T> error(Throwable error) {
		return new FlowError<>(error);
	}

	/**
	 * Decorate the specified {@link Publisher} with the {@link Flow} API.
	 *
	 * @param source the source to decorate
	 * @param <T> The type of values in both source and output sequences
	 * @return a new {@link Flow}, or the source itself if it already is one
	 */
	@SuppressWarnings("unchecked")
	public static <T> Flow<T> from(Publisher<? extends T> source) {
		if (source instanceof Flow) {
			return (Flow<T>) source;
		}
		return new FlowSource<>(source);
	}

	/**
	 * Create a {@link Flow} that emits the items contained in the provided {@link Iterable}.
	 *
	 * @param it the {@link Iterable} to read data from
	 * @param <T> The type of values in the source {@link Iterable} and resulting Flow
	 * @return a new {@link Flow}
	 */
	public static <T> Flow<T> fromIterable(Iterable<? extends T> it) {
		return new FlowIterable<>(it);
	}

	/**
	 * Create a new {@link Flow} that emits the specified item, then completes.
	 *
	 * @param data the single element to emit
	 * @param <T> the type of the produced item
	 * @return a new {@link Flow}
	 */
	public static <T> Flow<T> just(T data) {
		return new FlowJust<>(data);
	}

	/**
	 * Create a {@link Flow} that emits the provided elements and then completes.
	 *
	 * @param data the elements to emit, as a vararg
	 * @param <T> the emitted data type
	 * @return a new {@link Flow}
	 */
	@SafeVarargs
	public static <T> Flow<T> just(T... data) {
		return fromIterable(Arrays.asList(data));
	}

	/**
	 * Create a {@link Flow} that never signals anything.
	 *
	 * @param <T> the {@link Subscriber} type target
	 * @return a never completing {@link Flow}
	 */
	public static <T> Flow<T> never() {
		return FlowNever.instance();
	}

//	 ==============================================================================================================
//	 Operators
//	 ==============================================================================================================

	/**
	 * Merge this flow with another {@link Publisher}: values of both are relayed as they
	 * arrive, and the first terminal signal of either side (completion or failure)
	 * terminates the result and cancels the other side.
	 * <p>
	 * This is typically used to let a main sequence absorb the failure of a side channel.
	 *
	 * @param other the other source
	 * @return a {@link Flow} merging both sources until the first terminal signal
	 */
	public final Flow<T> absorb(Publisher<? extends T> other) {
		return new FlowAbsorb<>(this, other);
	}

	/**
	 * Race this flow with another {@link Publisher}: the first one to signal anything
	 * is relayed, the other is cancelled.
	 *
	 * @param other the competing source
	 * @return a {@link Flow} behaving like the fastest source
	 */
	public final Flow<T> ambWith(Publisher<? extends T> other) {
		return new FlowAmb<>(this, other);
	}

	/**
	 * Race this flow with other {@link Publisher Publishers}, this one first in the
	 * left fold.
	 *
	 * @param others the competing sources
	 * @return a {@link Flow} behaving like the fastest source
	 * @see #amb(Publisher[])
	 */
	@SafeVarargs
	public final Flow<T> ambWith(Publisher<? extends T>... others) {
		Flow<T> result = this;
		for (Publisher<? extends T> other : others) {
			result = new FlowAmb<>(result, other);
		}
		return result;
	}

	/**
	 * Turn a flow of {@link Event events} back into the signals they represent. A
	 * {@link EventType#FAILURE} event fails the result and a {@link EventType#FINISHED}
	 * event completes it, both cancelling the source.
	 *
	 * @param <X> the dematerialized type
	 * @return a dematerialized {@link Flow}
	 * @see #materialize()
	 */
	public final <X> Flow<X> dematerialize() {
		@SuppressWarnings("unchecked")
		Flow<Event<X>> thiz = (Flow<Event<X>>) this;
		return new FlowDematerialize<>(thiz);
	}

	/**
	 * Keep the failures of a flow of {@link Event events}, dropping the other kinds.
	 *
	 * @return a {@link Flow} of the materialized failures
	 * @see #materialize()
	 */
	public final Flow<Throwable> failures() {
		@SuppressWarnings("unchecked")
		Flow<Event<?>> thiz = (Flow<Event<?>>) this;
		return new FlowTransform<Event<?>, Throwable>(thiz, e -> e.isFailure() ? e.getFailure() : null, null);
	}

	/**
	 * Evaluate each source value against the given {@link Predicate}. Rejected values
	 * are dropped and replaced by a request to the upstream.
	 *
	 * @param p the {@link Predicate} to test values against
	 * @return a new {@link Flow} containing only values that pass the predicate test
	 */
	public final Flow<T> filter(Predicate<? super T> p) {
		Objects.requireNonNull(p, "predicate");
		return new FlowTransform<T, T>(this, t -> p.test(t) ? t : null, null);
	}

	/**
	 * Pair each value with its zero-based position in this subscription.
	 *
	 * @return an indexed {@link Flow} with each source value wrapped in a {@link Tuple2}
	 */
	public final Flow<Tuple2<Long, T>> index() {
		return new FlowIndex<>(this);
	}

	/**
	 * Observe all Reactive Streams signals and log them at INFO level under a category
	 * derived from this class.
	 *
	 * @return a {@link Flow} that logs signals
	 */
	public final Flow<T> log() {
		return log(null, Level.INFO);
	}

	/**
	 * Observe all Reactive Streams signals and log them at INFO level.
	 *
	 * @param category the logger category, null for the default one
	 * @return a {@link Flow} that logs signals
	 */
	public final Flow<T> log(@Nullable String category) {
		return log(category, Level.INFO);
	}

	/**
	 * Observe all Reactive Streams signals and log them at the given level.
	 * {@link Level#SEVERE} logs at ERROR, {@link Level#WARNING} at WARN,
	 * {@link Level#INFO} at INFO, {@link Level#CONFIG} and {@link Level#FINE} at DEBUG
	 * and anything finer at TRACE. Failures are always logged at ERROR.
	 *
	 * @param category the logger category, null for the default one
	 * @param level the level to log at
	 * @return a {@link Flow} that logs signals
	 */
	public final Flow<T> log(@Nullable String category, Level level) {
		return new FlowLog<>(this, category, level);
	}

	/**
	 * Transform the items emitted by this {@link Flow} by applying a synchronous function
	 * to each item. A mapper that throws (or returns null) terminates the flow with the
	 * thrown failure after cancelling the upstream.
	 *
	 * @param mapper the synchronous transforming {@link Function}
	 * @param <V> the transformed type
	 * @return a transformed {@link Flow}
	 */
	public final <V> Flow<V> map(Function<? super T, ? extends V> mapper) {
		Objects.requireNonNull(mapper, "mapper");
		return new FlowTransform<T, V>(this, t -> Objects.requireNonNull(mapper.apply(t), "The mapper returned a null value."), null);
	}

	/**
	 * Transform every signal of this flow into an {@link Event}: each value becomes
	 * {@link Event#value(Object)}, then the terminal signal becomes
	 * {@link Event#failure(Throwable)} or {@link Event#finished()}, after which the
	 * result completes. The result never fails.
	 *
	 * @return a {@link Flow} of materialized {@link Event}
	 */
	public final Flow<Event<T>> materialize() {
		return new FlowMaterialize<>(this);
	}

	/**
	 * Relay this flow, or switch to an alternative {@link Publisher} if it completes
	 * without emitting any value. Failures are relayed and never trigger the alternative.
	 *
	 * @param alternative the alternative {@link Publisher} if this sequence is empty
	 * @return a {@link Flow} falling back upon source completing without elements
	 */
	public final Flow<T> replaceEmptyWith(Publisher<? extends T> alternative) {
		return new FlowReplaceEmpty<>(this, alternative);
	}

	/**
	 * Relay this flow, or fail with the given error if it completes without emitting
	 * any value.
	 *
	 * @param error the failure to signal if this sequence is empty
	 * @return a {@link Flow} failing upon source completing without elements
	 */
	public final Flow<T> replaceEmptyWithError(Throwable error) {
		return replaceEmptyWith(error(error));
	}

	/**
	 * Retry this flow when a companion sequence signals a value in response to a
	 * failure.
	 * <p>
	 * The handler receives the {@link Flow} of failures of this flow and returns the
	 * companion. The source is subscribed once right away; each failure is swallowed and
	 * fed to the companion, and every value of the companion resubscribes the source.
	 * A failure or completion of the companion terminates the result the same way, and
	 * a successful completion of the source completes the result.
	 *
	 * @param whenFactory the {@link Function} building the companion from the failures
	 * @return a {@link Flow} that retries on failure as instructed by the companion
	 */
	public final Flow<T> retryWhen(Function<? super Flow<Throwable>, ? extends Publisher<?>> whenFactory) {
		return new FlowRetryWhen<>(this, whenFactory);
	}

	/**
	 * Share a single subscription to this flow among all subscribers and replay every
	 * value to late subscribers, forever.
	 *
	 * @return a replaying shared {@link Flow}
	 * @see #shareReplay(int, ReplayScope)
	 */
	public final Flow<T> shareReplay() {
		return shareReplay(Integer.MAX_VALUE, ReplayScope.FOREVER);
	}

	/**
	 * Share a single subscription to this flow among all subscribers and replay the
	 * latest {@code history} values to late subscribers, forever.
	 *
	 * @param history the number of values to replay
	 * @return a replaying shared {@link Flow}
	 * @see #shareReplay(int, ReplayScope)
	 */
	public final Flow<T> shareReplay(int history) {
		return shareReplay(history, ReplayScope.FOREVER);
	}

	/**
	 * Share a single subscription to this flow among all subscribers and replay the
	 * latest {@code history} values to late subscribers.
	 * <p>
	 * The first subscriber connects to the upstream, which is then requested unbounded.
	 * Each subscriber has its own buffer so that a slow subscriber never holds back the
	 * others. The {@link ReplayScope} decides what happens when the upstream terminates
	 * or all subscribers leave.
	 *
	 * @param history the number of values to replay, strictly positive
	 * @param scope how long the connection and the history are kept
	 * @return a replaying shared {@link Flow}
	 */
	public final Flow<T> shareReplay(int history, ReplayScope scope) {
		return new FlowShareReplay<>(this, history, scope);
	}

	/**
	 * Fail with the supplied failure if this flow does not emit its first signal
	 * (value or terminal) within the given timeout, measured from subscription on the
	 * shared {@link Schedulers#timer() timer}.
	 *
	 * @param timeout the maximum time to wait for the first signal
	 * @param failure the failure to signal on timeout
	 * @return a {@link Flow} guarded by a first-signal timeout
	 */
	public final Flow<T> timeoutFirst(Duration timeout, Supplier<? extends Throwable> failure) {
		return timeoutFirst(timeout, failure, Schedulers.timer());
	}

	/**
	 * Fail with the supplied failure if this flow does not emit its first signal
	 * (value or terminal) within the given timeout, measured on the given
	 * {@link Scheduler}. The upstream is cancelled on timeout.
	 *
	 * @param timeout the maximum time to wait for the first signal
	 * @param failure the failure to signal on timeout
	 * @param timer the {@link Scheduler} the timeout runs on
	 * @return a {@link Flow} guarded by a first-signal timeout
	 */
	public final Flow<T> timeoutFirst(Duration timeout, Supplier<? extends Throwable> failure, Scheduler timer) {
		return new FlowTimeoutFirst<>(this, timeout, failure, timer);
	}

	/**
	 * Keep the values of a flow of {@link Event events}, dropping the other kinds.
	 *
	 * @param <X> the value type of the events
	 * @return a {@link Flow} of the materialized values
	 * @see #materialize()
	 */
	public final <X> Flow<X> values() {
		@SuppressWarnings("unchecked")
		Flow<Event<X>> thiz = (Flow<Event<X>>) this;
		return new FlowTransform<Event<X>, X>(thiz, e -> e.isValue() ? e.getValue() : null, null);
	}

//	 ==============================================================================================================
//	 Subscribing
//	 ==============================================================================================================

	/**
	 * Subscribe to this {@link Flow} and request unbounded demand.
	 *
	 * @return a new {@link Disposable} that can be used to cancel the underlying {@link org.reactivestreams.Subscription}
	 */
	public final Disposable subscribe() {
		return subscribe(null, null, null);
	}

	/**
	 * Subscribe a {@link Consumer} to this {@link Flow} that will consume all the
	 * elements, requesting unbounded demand.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @return a new {@link Disposable} that can be used to cancel the underlying {@link org.reactivestreams.Subscription}
	 */
	public final Disposable subscribe(Consumer<? super T> consumer) {
		Objects.requireNonNull(consumer, "consumer");
		return subscribe(consumer, null, null);
	}

	/**
	 * Subscribe to this {@link Flow} with a {@link Consumer} for each value and one for
	 * the failure, requesting unbounded demand.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error signal
	 * @return a new {@link Disposable} that can be used to cancel the underlying {@link org.reactivestreams.Subscription}
	 */
	public final Disposable subscribe(@Nullable Consumer<? super T> consumer, Consumer<? super Throwable> errorConsumer) {
		Objects.requireNonNull(errorConsumer, "errorConsumer");
		return subscribe(consumer, errorConsumer, null);
	}

	/**
	 * Subscribe to this {@link Flow} with callbacks for every signal, requesting
	 * unbounded demand. A failure without an error consumer is reported through
	 * {@link Operators#onErrorDropped(Throwable)}.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error signal
	 * @param completeConsumer the callback to run on completion
	 * @return a new {@link Disposable} that can be used to cancel the underlying {@link org.reactivestreams.Subscription}
	 */
	public final Disposable subscribe(@Nullable Consumer<? super T> consumer,
			@Nullable Consumer<? super Throwable> errorConsumer,
			@Nullable Runnable completeConsumer) {
		LambdaSubscriber<T> subscriber = new LambdaSubscriber<>(consumer, errorConsumer, completeConsumer);
		subscribe(subscriber);
		return subscriber;
	}

	/**
	 * Subscribe the given {@link Subscriber}. A failure thrown while subscribing is
	 * delivered to the subscriber as an {@code onError} signal.
	 *
	 * @param actual the {@link Subscriber} interested in the signals
	 */
	@Override
	public final void subscribe(Subscriber<? super T> actual) {
		Objects.requireNonNull(actual, "actual");
		try {
			subscribeActual(actual);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			Operators.reportThrowInSubscribe(actual, e);
		}
	}

	/**
	 * Wire the given {@link Subscriber} to this flow. Implementations signal
	 * {@code onSubscribe} exactly once.
	 *
	 * @param actual the {@link Subscriber} interested in the signals
	 */
	protected abstract void subscribeActual(Subscriber<? super T> actual);

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
