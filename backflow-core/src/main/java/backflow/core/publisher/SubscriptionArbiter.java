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
import java.util.concurrent.locks.ReentrantLock;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.util.annotation.Nullable;

/**
 * A {@link Subscriber} that may be subscribed to several sources one after the other
 * while its downstream sees a single {@link Subscription}.
 * <p>
 * The arbiter keeps the downstream demand that is still outstanding. Each new source
 * is requested that amount, so subclasses must report what a finished source delivered
 * through {@link #produced(long)} before switching to the next one.
 *
 * @param <T> the value type
 */
abstract class SubscriptionArbiter<T> implements Subscriber<T>, Subscription {

	final Subscriber<? super T> actual;

	final ReentrantLock lock = new ReentrantLock();

	/** Guarded by {@link #lock}. */
	@Nullable
	Subscription current;

	/** Guarded by {@link #lock}. */
	long outstanding;

	volatile boolean cancelled;

	SubscriptionArbiter(Subscriber<? super T> actual) {
		this.actual = actual;
	}

	@Override
	public void onSubscribe(Subscription s) {
		switchTo(s);
	}

	@Override
	public void onError(Throwable t) {
		actual.onError(t);
	}

	@Override
	public void onComplete() {
		actual.onComplete();
	}

	/**
	 * Make {@code s} the current source and request the outstanding demand from it.
	 * A cancelled arbiter cancels {@code s} instead.
	 */
	final void switchTo(Subscription s) {
		Objects.requireNonNull(s, "s");
		long r;
		boolean c;
		lock.lock();
		try {
			c = cancelled;
			if (!c) {
				current = s;
			}
			r = outstanding;
		}
		finally {
			lock.unlock();
		}
		if (c) {
			s.cancel();
		}
		else if (r != 0L) {
			s.request(r);
		}
	}

	/**
	 * Deduct values the current source delivered from the outstanding demand.
	 *
	 * @param n the number of delivered values
	 */
	final void produced(long n) {
		lock.lock();
		try {
			if (outstanding != Long.MAX_VALUE) {
				long u = outstanding - n;
				if (u < 0L) {
					Operators.reportMoreProduced();
					u = 0L;
				}
				outstanding = u;
			}
		}
		finally {
			lock.unlock();
		}
	}

	@Override
	public void request(long n) {
		if (!Operators.validate(n)) {
			return;
		}
		Subscription s;
		lock.lock();
		try {
			outstanding = Operators.addCap(outstanding, n);
			s = current;
		}
		finally {
			lock.unlock();
		}
		if (s != null) {
			s.request(n);
		}
	}

	@Override
	public void cancel() {
		cancelled = true;
		Subscription s;
		lock.lock();
		try {
			s = current;
			current = null;
		}
		finally {
			lock.unlock();
		}
		if (s != null) {
			s.cancel();
		}
	}

	final boolean isCancelled() {
		return cancelled;
	}
}
