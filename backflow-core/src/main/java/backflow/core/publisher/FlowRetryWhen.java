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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.Function;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.core.Exceptions;
import backflow.util.annotation.Nullable;

/**
 * Retries a source when a companion publisher signals a value in response to a
 * failure of the source.
 * <p>
 * The source is subscribed once right away. Its failures are not relayed downstream:
 * they are fed to the companion instead, through a unicast {@link Flow} of failures,
 * and every value of the companion resubscribes the source. The companion's own
 * terminal signal terminates the result.
 *
 * @param <T> the value type
 */
final class FlowRetryWhen<T> extends Flow<T> {

	final Publisher<? extends T> source;

	final Function<? super Flow<Throwable>, ? extends Publisher<?>> whenFactory;

	FlowRetryWhen(Publisher<? extends T> source,
			Function<? super Flow<Throwable>, ? extends Publisher<?>> whenFactory) {
		this.source = Objects.requireNonNull(source, "source");
		this.whenFactory = Objects.requireNonNull(whenFactory, "whenFactory");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		FailureRelay relay = new FailureRelay();
		RetryWhenOtherSubscriber other = new RetryWhenOtherSubscriber();

		Subscriber<T> serial = new SerializedSubscriber<>(actual);

		RetryWhenMainSubscriber<T> main = new RetryWhenMainSubscriber<>(serial, relay, source);
		other.main = main;

		serial.onSubscribe(main);

		Publisher<?> p;

		try {
			p = Objects.requireNonNull(whenFactory.apply(relay),
					"The whenFactory returned a null Publisher");
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			main.whenError(Exceptions.unwrap(e));
			return;
		}

		p.subscribe(other);

		if (!main.cancelled) {
			source.subscribe(main);
		}
	}

	static final class RetryWhenMainSubscriber<T> extends SubscriptionArbiter<T> {

		final DeferredSubscription otherArbiter;

		final FailureRelay relay;

		final Publisher<? extends T> source;

		volatile int wip;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<RetryWhenMainSubscriber> WIP =
				AtomicIntegerFieldUpdater.newUpdater(RetryWhenMainSubscriber.class, "wip");

		long produced;

		RetryWhenMainSubscriber(Subscriber<? super T> actual, FailureRelay relay,
				Publisher<? extends T> source) {
			super(actual);
			this.relay = relay;
			this.source = source;
			this.otherArbiter = new DeferredSubscription();
		}

		@Override
		public void cancel() {
			if (isCancelled()) {
				return;
			}
			otherArbiter.cancel();
			relay.cancel();

			super.cancel();
		}

		void setWhen(Subscription w) {
			otherArbiter.set(w);
		}

		@Override
		public void onNext(T t) {
			actual.onNext(t);

			produced++;
		}

		@Override
		public void onError(Throwable t) {
			long p = produced;
			if (p != 0L) {
				produced = 0;
				produced(p);
			}

			otherArbiter.request(1);

			relay.push(t);
		}

		@Override
		public void onComplete() {
			otherArbiter.cancel();
			relay.cancel();

			actual.onComplete();
		}

		void resubscribe() {
			if (WIP.getAndIncrement(this) == 0) {
				do {
					if (cancelled) {
						return;
					}

							source.subscribe(this);

				} while (WIP.decrementAndGet(this) != 0);
			}
		}

		void whenError(Throwable e) {
			relay.cancel();
			super.cancel();

			actual.onError(e);
		}

		void whenComplete() {
			relay.cancel();
			super.cancel();

			actual.onComplete();
		}
	}

	static final class RetryWhenOtherSubscriber implements Subscriber<Object> {

		RetryWhenMainSubscriber<?> main;

		@Override
		public void onSubscribe(Subscription s) {
			main.setWhen(s);
		}

		@Override
		public void onNext(Object t) {
			main.resubscribe();
		}

		@Override
		public void onError(Throwable t) {
			main.whenError(t);
		}

		@Override
		public void onComplete() {
			main.whenComplete();
		}
	}

	/**
	 * The failures of the source, as handed to the companion factory. Only one
	 * subscriber is allowed; failures pushed while nobody is subscribed are ignored.
	 */
	static final class FailureRelay extends Flow<Throwable> {

		@Nullable
		volatile DemandBuffer<Throwable> buffer;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<FailureRelay, DemandBuffer> BUFFER =
				AtomicReferenceFieldUpdater.newUpdater(FailureRelay.class, DemandBuffer.class, "buffer");

		volatile boolean cancelled;

		@Override
		protected void subscribeActual(Subscriber<? super Throwable> actual) {
			DemandBuffer<Throwable> b = new DemandBuffer<>(actual);
			if (!BUFFER.compareAndSet(this, null, b)) {
				Operators.error(actual, new IllegalStateException(
						"The failures of retryWhen allow only one Subscriber"));
				return;
			}
			actual.onSubscribe(new Subscription() {
				@Override
				public void request(long n) {
					b.request(n);
				}

				@Override
				public void cancel() {
					b.cancel();
				}
			});
			if (cancelled) {
				b.cancel();
			}
		}

		void push(Throwable failure) {
			DemandBuffer<Throwable> b = buffer;
			if (b == null || !b.tryBuffer(failure)) {
				Operators.onErrorDropped(failure);
			}
		}

		void cancel() {
			cancelled = true;
			DemandBuffer<Throwable> b = buffer;
			if (b != null) {
				b.cancel();
			}
		}
	}
}
