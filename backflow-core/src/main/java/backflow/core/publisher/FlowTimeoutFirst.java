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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.Supplier;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import backflow.core.Disposable;
import backflow.core.Exceptions;
import backflow.core.scheduler.Scheduler;
import backflow.util.annotation.Nullable;

/**
 * Fails with a supplied failure, cancelling the source, unless the source signals
 * something (a value or a terminal event) before a timer fires.
 *
 * @param <T> the value type
 */
final class FlowTimeoutFirst<T> extends Flow<T> {

	final Publisher<? extends T> source;

	final Duration timeout;

	final Supplier<? extends Throwable> failure;

	final Scheduler timer;

	FlowTimeoutFirst(Publisher<? extends T> source, Duration timeout,
			Supplier<? extends Throwable> failure, Scheduler timer) {
		this.source = Objects.requireNonNull(source, "source");
		this.timeout = Objects.requireNonNull(timeout, "timeout");
		this.failure = Objects.requireNonNull(failure, "failure");
		this.timer = Objects.requireNonNull(timer, "timer");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		TimeoutFirstSubscriber<T> sink = new TimeoutFirstSubscriber<>(actual, failure);

		actual.onSubscribe(sink);

		Disposable task;
		try {
			task = timer.schedule(sink::timeout, timeout.toNanos(), TimeUnit.NANOSECONDS);
		}
		catch (RejectedExecutionException ree) {
			sink.rejected(ree);
			return;
		}
		sink.setTimer(task);

		source.subscribe(sink);
	}

	static final class TimeoutFirstSubscriber<T> extends DemandSink<T, T> {

		static final int WAITING   = 0;
		static final int SEEN      = 1;
		static final int TIMED_OUT = 2;

		static final Disposable DISPOSED = () -> { };

		final Supplier<? extends Throwable> failure;

		volatile int state;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<TimeoutFirstSubscriber> STATE =
				AtomicIntegerFieldUpdater.newUpdater(TimeoutFirstSubscriber.class, "state");

		@Nullable
		volatile Disposable timerTask;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<TimeoutFirstSubscriber, Disposable> TIMER_TASK =
				AtomicReferenceFieldUpdater.newUpdater(TimeoutFirstSubscriber.class, Disposable.class, "timerTask");

		TimeoutFirstSubscriber(Subscriber<? super T> actual, Supplier<? extends Throwable> failure) {
			super(actual);
			this.failure = failure;
		}

		void setTimer(Disposable task) {
			if (!TIMER_TASK.compareAndSet(this, null, task)) {
				task.dispose();
			}
		}

		void disposeTimer() {
			Disposable d = TIMER_TASK.getAndSet(this, DISPOSED);
			if (d != null && d != DISPOSED) {
				d.dispose();
			}
		}

		/**
		 * @return false if the timeout already fired and the signal must be ignored
		 */
		boolean signalled() {
			int s = state;
			if (s == WAITING && STATE.compareAndSet(this, WAITING, SEEN)) {
				disposeTimer();
				return true;
			}
			return state == SEEN;
		}

		void timeout() {
			if (!STATE.compareAndSet(this, WAITING, TIMED_OUT)) {
				return;
			}
			cancelUpstream();
			Throwable f;
			try {
				f = Objects.requireNonNull(failure.get(), "The failure supplier returned a null Throwable");
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				f = Exceptions.unwrap(e);
			}
			buffer.complete(f);
		}

		void rejected(RejectedExecutionException ree) {
			if (STATE.compareAndSet(this, WAITING, TIMED_OUT)) {
				buffer.complete(ree);
			}
		}

		@Override
		public void onNext(T t) {
			if (signalled()) {
				super.onNext(t);
			}
			else {
				Operators.onNextDropped(t);
			}
		}

		@Override
		public void onError(Throwable t) {
			if (signalled()) {
				super.onError(t);
			}
			else {
				Operators.onErrorDropped(t);
			}
		}

		@Override
		public void onComplete() {
			if (signalled()) {
				super.onComplete();
			}
		}

		@Override
		public void cancel() {
			disposeTimer();
			super.cancel();
		}
	}
}
