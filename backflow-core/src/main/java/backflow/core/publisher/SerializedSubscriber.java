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

import java.util.ArrayDeque;
import java.util.Queue;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.util.annotation.Nullable;

/**
 * Subscriber that makes sure signals are delivered sequentially in case the onNext,
 * onError or onComplete methods are called concurrently, as happens when an operator
 * relays several upstreams to one downstream.
 * <p>
 * The implementation uses {@code synchronized (this)} to ensure mutual exclusion. The
 * thread that is emitting delivers the signals other threads queued in the meantime.
 * <p>
 * Note that the class implements Subscription to save on allocation.
 *
 * @param <T> the value type
 */
final class SerializedSubscriber<T> implements Subscriber<T>, Subscription {

	final Subscriber<? super T> actual;

	boolean emitting;

	boolean missed;

	volatile boolean done;

	volatile boolean cancelled;

	@Nullable
	Queue<T> pending;

	@Nullable
	Throwable error;

	Subscription s;

	SerializedSubscriber(Subscriber<? super T> actual) {
		this.actual = actual;
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (Operators.validate(this.s, s)) {
			this.s = s;

			actual.onSubscribe(this);
		}
	}

	@Override
	public void onNext(T t) {
		if (cancelled || done) {
			return;
		}

		synchronized (this) {
			if (cancelled || done) {
				return;
			}

			if (emitting) {
				Queue<T> q = pending;
				if (q == null) {
					q = new ArrayDeque<>();
					pending = q;
				}
				q.offer(t);
				missed = true;
				return;
			}

			emitting = true;
		}

		actual.onNext(t);

		drainLoop();
	}

	@Override
	public void onError(Throwable t) {
		if (cancelled || done) {
			Operators.onErrorDropped(t);
			return;
		}

		synchronized (this) {
			if (cancelled || done) {
				Operators.onErrorDropped(t);
				return;
			}

			done = true;
			error = t;

			if (emitting) {
				missed = true;
				return;
			}
		}

		actual.onError(t);
	}

	@Override
	public void onComplete() {
		if (cancelled || done) {
			return;
		}

		synchronized (this) {
			if (cancelled || done) {
				return;
			}

			done = true;

			if (emitting) {
				missed = true;
				return;
			}
		}

		actual.onComplete();
	}

	@Override
	public void request(long n) {
		s.request(n);
	}

	@Override
	public void cancel() {
		cancelled = true;
		s.cancel();
	}

	void drainLoop() {
		for (;;) {

			if (cancelled) {
				return;
			}

			boolean d;
			Throwable e;
			Queue<T> q;

			synchronized (this) {
				if (cancelled) {
					return;
				}

				if (!missed) {
					emitting = false;
					return;
				}

				missed = false;

				d = done;
				e = error;
				q = pending;

				pending = null;
			}

			if (q != null) {
				for (T v : q) {
					if (cancelled) {
						return;
					}

					actual.onNext(v);
				}
			}

			if (cancelled) {
				return;
			}

			if (e != null) {
				actual.onError(e);
				return;
			}
			else if (d) {
				actual.onComplete();
				return;
			}
		}
	}
}
