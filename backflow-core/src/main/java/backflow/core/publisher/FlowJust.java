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

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Emits a single value, then completes.
 *
 * @param <T> the value type
 */
final class FlowJust<T> extends Flow<T> {

	final T value;

	FlowJust(T value) {
		this.value = Objects.requireNonNull(value, "value");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		actual.onSubscribe(new ScalarSubscription<>(actual, value));
	}

	@Override
	public String toString() {
		return "FlowJust(" + value + ")";
	}

	/**
	 * Delivers the value and completes on the first valid request.
	 */
	static final class ScalarSubscription<T> implements Subscription {

		final Subscriber<? super T> actual;

		final T value;

		volatile int once;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<ScalarSubscription> ONCE =
				AtomicIntegerFieldUpdater.newUpdater(ScalarSubscription.class, "once");

		ScalarSubscription(Subscriber<? super T> actual, T value) {
			this.actual = actual;
			this.value = value;
		}

		@Override
		public void request(long n) {
			if (Operators.validate(n)) {
				if (ONCE.compareAndSet(this, 0, 1)) {
					Subscriber<? super T> a = actual;
					a.onNext(value);
					if (once != 2) {
						a.onComplete();
					}
				}
			}
		}

		@Override
		public void cancel() {
			ONCE.lazySet(this, 2);
		}
	}
}
