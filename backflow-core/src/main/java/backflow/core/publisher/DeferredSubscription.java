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

import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscription;

import backflow.util.annotation.Nullable;

/**
 * A {@link Subscription} slot filled once, possibly after requests or a cancellation
 * already came in. Requests made while the slot is empty are added up and forwarded
 * when the subscription is {@link #set(Subscription) set}.
 */
final class DeferredSubscription implements Subscription {

	@Nullable
	volatile Subscription s;
	static final AtomicReferenceFieldUpdater<DeferredSubscription, Subscription> S =
			AtomicReferenceFieldUpdater.newUpdater(DeferredSubscription.class, Subscription.class, "s");

	volatile long pending;
	static final AtomicLongFieldUpdater<DeferredSubscription> PENDING =
			AtomicLongFieldUpdater.newUpdater(DeferredSubscription.class, "pending");

	/**
	 * Fill the slot and forward the requests made so far.
	 *
	 * @param subscription the subscription to hold
	 * @return false if the slot was cancelled or already filled, in which case
	 * {@code subscription} is cancelled
	 */
	boolean set(Subscription subscription) {
		if (!Operators.setOnce(S, this, subscription)) {
			return false;
		}
		flushPending(subscription);
		return true;
	}

	@Override
	public void request(long n) {
		Subscription a = s;
		if (a != null) {
			a.request(n);
			return;
		}
		Operators.addCap(PENDING, this, n);
		a = s;
		if (a != null) {
			flushPending(a);
		}
	}

	@Override
	public void cancel() {
		Operators.terminate(S, this);
	}

	boolean isCancelled() {
		return s == Operators.cancelledSubscription();
	}

	void flushPending(Subscription a) {
		long r = PENDING.getAndSet(this, 0L);
		if (r != 0L) {
			a.request(r);
		}
	}
}
