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
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Subscriber;

import backflow.core.Exceptions;
import backflow.util.annotation.Nullable;

/**
 * A buffer that regulates the demand between a producer and a single {@link Subscriber}.
 * <p>
 * Values pushed with {@link #buffer(Object)} are delivered in FIFO order, each one
 * consuming a unit of the demand accumulated through {@link #request(long)}. The
 * subscriber may add demand re-entrantly from its {@code onNext}; that demand is
 * accounted for before the next delivery decision.
 * <p>
 * {@link #buffer(Object)} and {@link #request(long)} return the demand that has been
 * requested downstream but not yet forwarded upstream, so that the owner of the buffer
 * never over-requests from its source. Demand already sent upstream outside of these
 * calls (a prefetch) is recorded with {@link #prefetch(long)}.
 * <p>
 * A terminal signal, failure or completion alike, discards the values that the current
 * demand cannot absorb and is delivered right after the deliverable ones. Producers
 * whose last value must not be lost use {@link #bufferLast(Object)} instead, which
 * completes only once that value has been delivered. Exactly one terminal signal is
 * ever delivered, and none after {@link #cancel()}.
 * <p>
 * All deliveries are serialized by a work-in-progress counter: the thread that wins
 * the counter drains on behalf of every concurrent caller, and no lock is held while
 * the subscriber is invoked.
 *
 * @param <T> the buffered value type
 */
public final class DemandBuffer<T> {

	/**
	 * The default capacity of a buffer, {@link Integer#MAX_VALUE} (unbounded) unless the
	 * {@code backflow.bufferSize.default} system property says otherwise.
	 */
	public static final int DEFAULT_CAPACITY = Math.max(1,
			Integer.parseInt(System.getProperty("backflow.bufferSize.default",
					String.valueOf(Integer.MAX_VALUE))));

	final Subscriber<? super T> actual;
	final Queue<T>              queue;
	final int                   capacity;

	@Nullable
	Throwable error;
	volatile boolean done;
	/**
	 * Set by {@link #bufferLast(Object)}: the completion waits for the queue to drain.
	 */
	volatile boolean drainBeforeDone;
	volatile boolean cancelled;
	/**
	 * Set once the terminal signal (or nothing, if cancelled) has been handed to the
	 * subscriber. Only accessed by the draining thread.
	 */
	boolean finished;
	/**
	 * Number of values delivered. Only accessed by the draining thread.
	 */
	long processed;

	volatile int terminated;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DemandBuffer> TERMINATED =
			AtomicIntegerFieldUpdater.newUpdater(DemandBuffer.class, "terminated");

	volatile int size;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DemandBuffer> SIZE =
			AtomicIntegerFieldUpdater.newUpdater(DemandBuffer.class, "size");

	volatile int wip;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DemandBuffer> WIP =
			AtomicIntegerFieldUpdater.newUpdater(DemandBuffer.class, "wip");

	volatile long requested;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<DemandBuffer> REQUESTED =
			AtomicLongFieldUpdater.newUpdater(DemandBuffer.class, "requested");

	volatile long sent;
	@SuppressWarnings("rawtypes")
	static final AtomicLongFieldUpdater<DemandBuffer> SENT =
			AtomicLongFieldUpdater.newUpdater(DemandBuffer.class, "sent");

	/**
	 * Create a buffer of {@link #DEFAULT_CAPACITY} delivering to the given subscriber.
	 *
	 * @param actual the subscriber values and the terminal signal are delivered to
	 */
	public DemandBuffer(Subscriber<? super T> actual) {
		this(actual, DEFAULT_CAPACITY);
	}

	/**
	 * Create a buffer holding at most {@code capacity} undelivered values.
	 *
	 * @param actual the subscriber values and the terminal signal are delivered to
	 * @param capacity the maximum number of undelivered values, strictly positive
	 */
	public DemandBuffer(Subscriber<? super T> actual, int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity > 0 required but it was " + capacity);
		}
		this.actual = Objects.requireNonNull(actual, "actual");
		this.capacity = capacity;
		this.queue = new ConcurrentLinkedQueue<>();
	}

	/**
	 * Buffer a value and deliver as many values as the current demand allows.
	 * <p>
	 * Once {@link #cancel() cancelled} the value is dropped (see
	 * {@link Operators#onNextDropped(Object)}). Exceeding the capacity drops the value
	 * and terminates the buffer with an {@link Exceptions#failWithOverflow() overflow}
	 * error, which the owner observes through {@link #isTerminated()}.
	 *
	 * @param value the value to buffer
	 * @return the demand not yet forwarded upstream, {@link Long#MAX_VALUE} if unbounded
	 * @throws IllegalStateException if the buffer has already been {@link #complete(Throwable) completed}
	 */
	public long buffer(T value) {
		Objects.requireNonNull(value, "value");
		if (cancelled) {
			Operators.onNextDropped(value);
			return 0L;
		}
		if (terminated != 0) {
			throw Exceptions.failWithTerminated("a value");
		}
		if (!offer(value)) {
			drain();
			return 0L;
		}
		drain();
		return claimDemand();
	}

	/**
	 * Buffer a value unless the buffer has been completed or cancelled, in which case the
	 * value is rejected and left to the caller. This is the variant for producers that
	 * may race with another producer's terminal signal.
	 *
	 * @param value the value to buffer
	 * @return true if the value was accepted
	 */
	public boolean tryBuffer(T value) {
		Objects.requireNonNull(value, "value");
		if (cancelled || terminated != 0) {
			return false;
		}
		if (!offer(value)) {
			drain();
			return false;
		}
		drain();
		return true;
	}

	/**
	 * Buffer a final value and complete successfully once it, and every value queued
	 * before it, has been delivered. Until then the completion waits for demand.
	 *
	 * @param value the last value
	 * @return true if this call terminated the buffer, false if it was already
	 * terminated or cancelled, in which case the value is dropped
	 */
	public boolean bufferLast(T value) {
		Objects.requireNonNull(value, "value");
		if (cancelled || terminated != 0) {
			Operators.onNextDropped(value);
			return false;
		}
		if (!offer(value)) {
			drain();
			return false;
		}
		if (!TERMINATED.compareAndSet(this, 0, 1)) {
			drain();
			return false;
		}
		drainBeforeDone = true;
		done = true;
		drain();
		return true;
	}

	/**
	 * Complete the buffer with a terminal signal. Values that the current demand cannot
	 * absorb are discarded. Only the first call has an effect.
	 *
	 * @param failure the failure to deliver, or null for a successful completion
	 * @return true if this call terminated the buffer, false if it was already terminated
	 */
	public boolean complete(@Nullable Throwable failure) {
		if (!TERMINATED.compareAndSet(this, 0, 1)) {
			if (failure != null && !cancelled) {
				Operators.onErrorDropped(failure);
			}
			return false;
		}
		error = failure;
		done = true;
		drain();
		return true;
	}

	/**
	 * Add downstream demand and deliver as many buffered values as it allows.
	 *
	 * @param n the additional demand, strictly positive
	 * @return the demand not yet forwarded upstream, {@link Long#MAX_VALUE} if unbounded
	 */
	public long request(long n) {
		if (!Operators.validate(n)) {
			return 0L;
		}
		Operators.addCap(REQUESTED, this, n);
		drain();
		return claimDemand();
	}

	/**
	 * Record demand that the owner sent upstream ahead of any downstream request, so
	 * that it is not forwarded a second time.
	 *
	 * @param n the prefetched amount
	 * @return the prefetched amount, to be requested from upstream
	 */
	public long prefetch(long n) {
		if (!Operators.validate(n)) {
			return 0L;
		}
		Operators.addCap(SENT, this, n);
		return n;
	}

	/**
	 * Cancel the buffer: queued values are discarded and nothing more is delivered.
	 */
	public void cancel() {
		if (cancelled) {
			return;
		}
		cancelled = true;
		if (WIP.getAndIncrement(this) == 0) {
			discard();
		}
	}

	/**
	 * @return true once {@link #cancel()} has been called
	 */
	public boolean isCancelled() {
		return cancelled;
	}

	/**
	 * @return true once a terminal signal has been accepted, whether delivered yet or not
	 */
	public boolean isTerminated() {
		return terminated != 0;
	}

	/**
	 * @return the number of values waiting for demand
	 */
	public int size() {
		return size;
	}

	/**
	 * Enqueue without draining. Callers that offer under a lock drain once it is released.
	 *
	 * @return false if the value was rejected because the buffer is full, in which case
	 * the buffer has been terminated with an overflow error
	 */
	boolean offer(T value) {
		if (SIZE.incrementAndGet(this) > capacity) {
			SIZE.decrementAndGet(this);
			Operators.onNextDropped(value);
			terminate(Exceptions.failWithOverflow());
			return false;
		}
		queue.offer(value);
		return true;
	}

	/**
	 * Accept a terminal signal without draining.
	 *
	 * @return true if this call terminated the buffer
	 */
	boolean terminate(@Nullable Throwable failure) {
		if (!TERMINATED.compareAndSet(this, 0, 1)) {
			return false;
		}
		error = failure;
		done = true;
		return true;
	}

	long claimDemand() {
		for (;;) {
			if (terminated != 0 || cancelled) {
				return 0L;
			}
			long s = sent;
			long r = requested;
			if (s >= r) {
				return 0L;
			}
			if (SENT.compareAndSet(this, s, r)) {
				return r == Long.MAX_VALUE ? Long.MAX_VALUE : r - s;
			}
		}
	}

	void drain() {
		if (WIP.getAndIncrement(this) != 0) {
			return;
		}

		final Subscriber<? super T> a = actual;
		final Queue<T> q = queue;
		int missed = 1;

		for (;;) {
			long e = processed;
			long r = requested;

			while (r == Long.MAX_VALUE || e < r) {
				boolean d = done;
				T v = q.poll();
				boolean empty = v == null;

				if (checkTerminated(d, empty)) {
					return;
				}

				if (empty) {
					break;
				}

				SIZE.decrementAndGet(this);
				e++;
				processed = e;
				a.onNext(v);
				r = requested;
			}

			if (r != Long.MAX_VALUE && e >= r) {
				boolean d = done;
				if (checkTerminated(d, q.isEmpty() || (d && !drainBeforeDone))) {
					return;
				}
			}

			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	boolean checkTerminated(boolean d, boolean empty) {
		if (finished) {
			return true;
		}
		if (cancelled) {
			finished = true;
			discard();
			return true;
		}
		if (d && empty) {
			finished = true;
			discard();
			Throwable ex = error;
			if (ex != null) {
				actual.onError(ex);
			}
			else {
				actual.onComplete();
			}
			return true;
		}
		return false;
	}

	void discard() {
		queue.clear();
		size = 0;
	}

	@Override
	public String toString() {
		return "DemandBuffer{" + "requested=" + requested + ", sent=" + sent + ", size=" + size + ", terminated=" + (terminated != 0) + ", cancelled=" + cancelled + '}';
	}
}
