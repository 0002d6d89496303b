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

import java.util.Objects;
import java.util.function.Function;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.core.Exceptions;
import backflow.util.annotation.Nullable;

/**
 * Subscribes to an upstream publisher and feeds a downstream {@link Subscriber}
 * through a {@link DemandBuffer}, optionally transforming values and failures on the
 * way.
 * <p>
 * The sink is both the upstream's {@link Subscriber} and the downstream's
 * {@link Subscription}. The usual wiring is:
 * <pre>
 * DemandSink&lt;I, O&gt; sink = new DemandSink&lt;&gt;(actual, mapper, null);
 * actual.onSubscribe(sink);
 * source.subscribe(sink);
 * </pre>
 * Demand requested before the upstream subscription arrives is remembered and
 * forwarded once it does. Only the net new demand computed by the buffer is ever
 * forwarded upstream.
 * <ul>
 *     <li>A value transform returning {@code null} drops the value and requests a
 *     replacement from upstream, leaving the downstream demand untouched.</li>
 *     <li>A value transform that throws cancels the upstream and terminates the sink
 *     with the thrown failure ({@link Exceptions#unwrap(Throwable) unwrapped}).</li>
 *     <li>A failure transform returning {@code null} swallows the failure: the
 *     downstream completes successfully instead.</li>
 * </ul>
 * Subclasses customize delivery by overriding {@link #emit(Object)} and
 * {@link #terminate(Throwable)}.
 *
 * @param <I> the upstream value type
 * @param <O> the downstream value type
 */
public class DemandSink<I, O> implements Subscriber<I>, Subscription {

	/**
	 * The buffer values are delivered through.
	 */
	protected final DemandBuffer<O> buffer;

	final DeferredSubscription upstream;

	@Nullable
	final Function<? super I, ? extends O> valueTransform;

	@Nullable
	final Function<? super Throwable, ? extends Throwable> failureTransform;

	boolean done;

	/**
	 * Create a sink that relays values and failures unchanged. The upstream value type
	 * must be assignable to the downstream one.
	 *
	 * @param actual the downstream subscriber
	 */
	public DemandSink(Subscriber<? super O> actual) {
		this(actual, null, null);
	}

	/**
	 * Create a sink with the given transforms. A {@code null} transform relays
	 * unchanged, in which case the upstream type must be assignable to the downstream one.
	 *
	 * @param actual the downstream subscriber
	 * @param valueTransform the value transform, may return null to drop a value
	 * @param failureTransform the failure transform, may return null to swallow a failure
	 */
	public DemandSink(Subscriber<? super O> actual,
			@Nullable Function<? super I, ? extends O> valueTransform,
			@Nullable Function<? super Throwable, ? extends Throwable> failureTransform) {
		this(new DemandBuffer<>(Objects.requireNonNull(actual, "actual")), valueTransform, failureTransform);
	}

	/**
	 * Create a sink delivering through an existing buffer, possibly shared with other
	 * sinks.
	 *
	 * @param buffer the buffer to deliver through
	 * @param valueTransform the value transform, may return null to drop a value
	 * @param failureTransform the failure transform, may return null to swallow a failure
	 */
	protected DemandSink(DemandBuffer<O> buffer,
			@Nullable Function<? super I, ? extends O> valueTransform,
			@Nullable Function<? super Throwable, ? extends Throwable> failureTransform) {
		this.buffer = Objects.requireNonNull(buffer, "buffer");
		this.valueTransform = valueTransform;
		this.failureTransform = failureTransform;
		this.upstream = new DeferredSubscription();
	}

	@Override
	public void onSubscribe(Subscription s) {
		upstream.set(s);
	}

	@Override
	@SuppressWarnings("unchecked")
	public void onNext(I t) {
		if (done) {
			Operators.onNextDropped(t);
			return;
		}
		O v;
		if (valueTransform == null) {
			v = (O) t;
		}
		else {
			try {
				v = valueTransform.apply(t);
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				done = true;
				upstream.cancel();
				terminate(Exceptions.unwrap(e));
				return;
			}
		}
		if (v == null) {
			upstream.request(1);
			return;
		}
		emit(v);
	}

	@Override
	public void onError(Throwable t) {
		if (done) {
			Operators.onErrorDropped(t);
			return;
		}
		done = true;
		Throwable f = t;
		if (failureTransform != null) {
			try {
				f = failureTransform.apply(t);
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				f = Exceptions.unwrap(e);
				if (f != t) {
					f.addSuppressed(t);
				}
			}
		}
		terminate(f);
	}

	@Override
	public void onComplete() {
		if (done) {
			return;
		}
		done = true;
		terminate(null);
	}

	@Override
	public void request(long n) {
		long d = buffer.request(n);
		if (d > 0L) {
			upstream.request(d);
		}
	}

	@Override
	public void cancel() {
		upstream.cancel();
		buffer.cancel();
	}

	/**
	 * Hand a transformed value to the buffer. The default buffers it, forwards any
	 * net new demand upstream and cancels the upstream if the buffer overflowed.
	 *
	 * @param value the transformed value
	 */
	protected void emit(O value) {
		long d = buffer.buffer(value);
		if (d > 0L) {
			upstream.request(d);
		}
		else if (buffer.isTerminated()) {
			done = true;
			upstream.cancel();
		}
	}

	/**
	 * Hand the (transformed) terminal signal to the buffer.
	 *
	 * @param failure the failure, or null for a successful completion
	 */
	protected void terminate(@Nullable Throwable failure) {
		buffer.complete(failure);
	}

	/**
	 * Request from the upstream subscription, or remember the demand until it arrives.
	 *
	 * @param n the amount to request
	 */
	protected final void requestUpstream(long n) {
		upstream.request(n);
	}

	/**
	 * Cancel the upstream subscription only, leaving the buffer untouched.
	 */
	protected final void cancelUpstream() {
		upstream.cancel();
	}

	/**
	 * @return true once the upstream signalled a terminal event or the sink
	 * terminated itself
	 */
	protected final boolean isDone() {
		return done;
	}
}
