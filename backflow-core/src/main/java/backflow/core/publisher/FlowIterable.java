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

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.core.Exceptions;

/**
 * Emits the contents of an {@link Iterable}, honoring demand.
 *
 * @param <T> the value type
 */
final class FlowIterable<T> extends Flow<T> {

	final Iterable<? extends T> iterable;

	FlowIterable(Iterable<? extends T> iterable) {
		this.iterable = Objects.requireNonNull(iterable, "iterable");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		Iterator<? extends T> it;
		boolean hasNext;
		try {
			it = Objects.requireNonNull(iterable.iterator(), "The iterator returned is null");
			hasNext = it.hasNext();
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			Operators.error(actual, e);
			return;
		}
		if (!hasNext) {
			Operators.complete(actual);
			return;
		}
		actual.onSubscribe(new IterableSubscription<>(actual, it));
	}

	static final class IterableSubscription<T> implements Subscription {

		final Subscriber<? super T> actual;

		final Iterator<? extends T> iterator;

		volatile boolean cancelled;

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<IterableSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(IterableSubscription.class, "requested");

		IterableSubscription(Subscriber<? super T> actual, Iterator<? extends T> iterator) {
			this.actual = actual;
			this.iterator = iterator;
		}

		@Override
		public void request(long n) {
			if (Operators.validate(n)) {
				if (Operators.addCap(REQUESTED, this, n) == 0) {
					emit(n);
				}
			}
		}

		@Override
		public void cancel() {
			cancelled = true;
		}

		void emit(long n) {
			final Subscriber<? super T> s = actual;
			final Iterator<? extends T> it = iterator;

			long e = 0L;

			for (;;) {
				while (e != n) {
					T t;
					boolean b;
					try {
						t = Objects.requireNonNull(it.next(), "The iterator returned a null value");
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						s.onError(ex);
						return;
					}

					if (cancelled) {
						return;
					}

					s.onNext(t);

					if (cancelled) {
						return;
					}

					try {
						b = it.hasNext();
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						s.onError(ex);
						return;
					}

					if (cancelled) {
						return;
					}

					if (!b) {
						s.onComplete();
						return;
					}

					e++;
				}

				n = requested;

				if (n == e) {
					n = REQUESTED.addAndGet(this, -e);
					if (n == 0L) {
						return;
					}
					e = 0L;
				}
			}
		}
	}
}
