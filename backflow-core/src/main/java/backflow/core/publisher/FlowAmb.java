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
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

/**
 * Races two publishers: the first to signal anything (value or terminal) is relayed and
 * the other is cancelled. N-ary races are built by folding pairs.
 * <p>
 * Each side is prefetched one element so that it can signal its first value. Demand
 * requested before a winner is known accumulates and is handed to the winner, net of
 * the prefetch.
 *
 * @param <T> the value type
 */
final class FlowAmb<T> extends Flow<T> {

	final Publisher<? extends T> left;
	final Publisher<? extends T> right;

	FlowAmb(Publisher<? extends T> left, Publisher<? extends T> right) {
		this.left = Objects.requireNonNull(left, "left");
		this.right = Objects.requireNonNull(right, "right");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		AmbCoordinator<T> coordinator = new AmbCoordinator<>(actual);
		actual.onSubscribe(coordinator);
		coordinator.subscribe(left, right);
	}

	static final class AmbCoordinator<T> implements Subscription {

		static final int UNDECIDED = -1;

		final AmbLeg<T>[] legs;

		volatile boolean cancelled;

		volatile int winner;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<AmbCoordinator> WINNER =
				AtomicIntegerFieldUpdater.newUpdater(AmbCoordinator.class, "winner");

		volatile long preDecisionDemand;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<AmbCoordinator> PRE_DECISION_DEMAND =
				AtomicLongFieldUpdater.newUpdater(AmbCoordinator.class, "preDecisionDemand");

		@SuppressWarnings("unchecked")
		AmbCoordinator(Subscriber<? super T> actual) {
			this.legs = new AmbLeg[]{new AmbLeg<>(actual, this, 0), new AmbLeg<>(actual, this, 1)};
			WINNER.lazySet(this, UNDECIDED);
		}

		void subscribe(Publisher<? extends T> left, Publisher<? extends T> right) {
			for (AmbLeg<T> leg : legs) {
				leg.requestUpstream(leg.buffer.prefetch(1));
			}
			left.subscribe(legs[0]);
			if (cancelled || winner != UNDECIDED) {
				return;
			}
			right.subscribe(legs[1]);
		}

		@Override
		public void request(long n) {
			if (!Operators.validate(n)) {
				return;
			}
			int w = winner;
			if (w >= 0) {
				legs[w].request(n);
				return;
			}
			Operators.addCap(PRE_DECISION_DEMAND, this, n);
			w = winner;
			if (w >= 0) {
				flushPreDecisionDemand(legs[w]);
			}
		}

		@Override
		public void cancel() {
			if (cancelled) {
				return;
			}
			cancelled = true;
			for (AmbLeg<T> leg : legs) {
				leg.cancel();
			}
		}

		/**
		 * @return true if the leg at the given index is (or just became) the winner
		 */
		boolean tryWin(int index) {
			int w = winner;
			if (w == UNDECIDED && WINNER.compareAndSet(this, UNDECIDED, index)) {
				legs[1 - index].cancel();
				flushPreDecisionDemand(legs[index]);
				return true;
			}
			return w == index || winner == index;
		}

		void flushPreDecisionDemand(AmbLeg<T> leg) {
			long d = PRE_DECISION_DEMAND.getAndSet(this, 0L);
			if (d > 0L) {
				leg.request(d);
			}
		}
	}

	static final class AmbLeg<T> extends DemandSink<T, T> {

		final AmbCoordinator<T> parent;
		final int               index;

		AmbLeg(Subscriber<? super T> actual, AmbCoordinator<T> parent, int index) {
			super(actual);
			this.parent = parent;
			this.index = index;
		}

		@Override
		public void onNext(T t) {
			if (parent.tryWin(index)) {
				super.onNext(t);
			}
		}

		@Override
		public void onError(Throwable t) {
			if (parent.tryWin(index)) {
				super.onError(t);
			}
			else {
				Operators.onErrorDropped(t);
			}
		}

		@Override
		public void onComplete() {
			if (parent.tryWin(index)) {
				super.onComplete();
			}
		}
	}
}
