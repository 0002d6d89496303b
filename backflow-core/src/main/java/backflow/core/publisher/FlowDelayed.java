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
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.core.Disposable;
import backflow.core.scheduler.Scheduler;
import backflow.util.annotation.Nullable;

/**
 * Emits a single value then completes, or fails, once a delay has elapsed on a
 * {@link Scheduler}. A value that finds no demand waits in a {@link DemandBuffer}.
 *
 * @param <T> the value type
 */
final class FlowDelayed<T> extends Flow<T> {

	@Nullable
	final T data;

	@Nullable
	final Throwable error;

	final Duration delay;

	final Scheduler timer;

	FlowDelayed(@Nullable T data, @Nullable Throwable error, Duration delay, Scheduler timer) {
		this.data = data;
		this.error = error;
		this.delay = Objects.requireNonNull(delay, "delay");
		this.timer = Objects.requireNonNull(timer, "timer");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		DelayedSubscription<T> r = new DelayedSubscription<>(actual, data, error);

		actual.onSubscribe(r);

		Disposable f;
		try {
			f = timer.schedule(r, delay.toNanos(), TimeUnit.NANOSECONDS);
		}
		catch (RejectedExecutionException ree) {
			r.rejected(ree);
			return;
		}
		r.setCancel(f);
	}

	static final class DelayedSubscription<T> implements Runnable, Subscription {

		static final Disposable FINISHED = () -> { };
		static final Disposable CANCELLED = () -> { };

		final DemandBuffer<T> buffer;

		@Nullable
		final T data;

		@Nullable
		final Throwable error;

		volatile Disposable cancel;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<DelayedSubscription, Disposable> CANCEL =
				AtomicReferenceFieldUpdater.newUpdater(DelayedSubscription.class,
						Disposable.class,
						"cancel");

		DelayedSubscription(Subscriber<? super T> actual, @Nullable T data, @Nullable Throwable error) {
			this.buffer = new DemandBuffer<>(actual);
			this.data = data;
			this.error = error;
		}

		void setCancel(Disposable cancel) {
			if (!CANCEL.compareAndSet(this, null, cancel)) {
				Disposable c = this.cancel;
				if (c == CANCELLED) {
					cancel.dispose();
				}
			}
		}

		void rejected(RejectedExecutionException ree) {
			if (CANCEL.compareAndSet(this, null, FINISHED)) {
				buffer.complete(ree);
			}
		}

		@Override
		public void run() {
			if (CANCEL.getAndSet(this, FINISHED) == CANCELLED) {
				return;
			}
			if (error != null) {
				buffer.complete(error);
				return;
			}
			if (data != null) {
				buffer.bufferLast(data);
			}
			else {
				buffer.complete(null);
			}
		}

		@Override
		public void request(long n) {
			buffer.request(n);
		}

		@Override
		public void cancel() {
			Disposable c = cancel;
			if (c != CANCELLED && c != FINISHED) {
				c = CANCEL.getAndSet(this, CANCELLED);
				if (c != null && c != CANCELLED && c != FINISHED) {
					c.dispose();
				}
			}
			buffer.cancel();
		}
	}
}
