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

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.util.annotation.Nullable;

/**
 * Merges two publishers until the first terminal signal of either one, which
 * terminates the result and cancels the other side.
 *
 * @param <T> the value type
 */
final class FlowAbsorb<T> extends Flow<T> {

	final Publisher<? extends T> main;
	final Publisher<? extends T> other;

	FlowAbsorb(Publisher<? extends T> main, Publisher<? extends T> other) {
		this.main = Objects.requireNonNull(main, "main");
		this.other = Objects.requireNonNull(other, "other");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		AbsorbCoordinator<T> coordinator = new AbsorbCoordinator<>(actual);
		actual.onSubscribe(coordinator);
		main.subscribe(coordinator.mainLeg);
		other.subscribe(coordinator.otherLeg);
	}

	static final class AbsorbCoordinator<T> implements Subscription {

		final DemandBuffer<T> buffer;
		final AbsorbLeg<T>    mainLeg;
		final AbsorbLeg<T>    otherLeg;

		AbsorbCoordinator(Subscriber<? super T> actual) {
			this.buffer = new DemandBuffer<>(actual);
			this.mainLeg = new AbsorbLeg<>(this);
			this.otherLeg = new AbsorbLeg<>(this);
		}

		@Override
		public void request(long n) {
			long d = buffer.request(n);
			if (d > 0L) {
				mainLeg.requestUpstream(d);
				otherLeg.requestUpstream(d);
			}
		}

		@Override
		public void cancel() {
			cancelLegs();
			buffer.cancel();
		}

		void cancelLegs() {
			mainLeg.cancelUpstream();
			otherLeg.cancelUpstream();
		}

		void terminated(AbsorbLeg<T> from, @Nullable Throwable failure) {
			if (buffer.complete(failure)) {
				(from == mainLeg ? otherLeg : mainLeg).cancelUpstream();
			}
		}
	}

	static final class AbsorbLeg<T> extends DemandSink<T, T> {

		final AbsorbCoordinator<T> parent;

		AbsorbLeg(AbsorbCoordinator<T> parent) {
			super(parent.buffer, null, null);
			this.parent = parent;
		}

		@Override
		protected void emit(T value) {
			boolean late = buffer.isTerminated();
			if (!buffer.tryBuffer(value)) {
				// overflowed values have already been dropped by the buffer
				if (late && !buffer.isCancelled()) {
					Operators.onNextDropped(value);
				}
				done = true;
				parent.cancelLegs();
			}
		}

		@Override
		protected void terminate(@Nullable Throwable failure) {
			parent.terminated(this, failure);
		}
	}
}
