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

import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscriber;
import reactor.test.publisher.TestPublisher;
import reactor.test.subscriber.TestSubscriber;

import static org.assertj.core.api.Assertions.assertThat;

public class SubscriptionArbiterTest {

	@Test
	public void outstandingDemandCarriesOverToNextSource() {
		TestSubscriber<Integer> ts = TestSubscriber.builder().initialRequest(0).build();
		Relay arbiter = new Relay(ts);
		ts.onSubscribe(arbiter);
		ts.request(5);

		TestPublisher<Integer> first = TestPublisher.create();
		first.subscribe(arbiter);
		first.assertMinRequested(5);
		first.next(1, 2);
		arbiter.produced(2);

		TestPublisher<Integer> second = TestPublisher.create();
		second.subscribe(arbiter);
		second.assertMinRequested(3);
		second.assertMaxRequested(3);

		assertThat(ts.getReceivedOnNext()).containsExactly(1, 2);
	}

	@Test
	public void requestIsForwardedToCurrentSource() {
		TestSubscriber<Integer> ts = TestSubscriber.builder().initialRequest(0).build();
		Relay arbiter = new Relay(ts);
		ts.onSubscribe(arbiter);

		TestPublisher<Integer> tp = TestPublisher.create();
		tp.subscribe(arbiter);
		tp.assertMaxRequested(0);

		ts.request(2);
		tp.assertMinRequested(2);
	}

	@Test
	public void unboundedDemandStaysUnbounded() {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		Relay arbiter = new Relay(ts);
		ts.onSubscribe(arbiter);
		arbiter.produced(10);

		TestPublisher<Integer> tp = TestPublisher.create();
		tp.subscribe(arbiter);
		tp.assertMinRequested(Long.MAX_VALUE);
	}

	@Test
	public void cancelReachesCurrentAndLaterSources() {
		TestSubscriber<Integer> ts = TestSubscriber.create();
		Relay arbiter = new Relay(ts);
		ts.onSubscribe(arbiter);

		TestPublisher<Integer> first = TestPublisher.create();
		first.subscribe(arbiter);
		ts.cancel();
		first.assertCancelled();
		assertThat(arbiter.isCancelled()).isTrue();

		TestPublisher<Integer> second = TestPublisher.create();
		second.subscribe(arbiter);
		second.assertCancelled();
	}

	static final class Relay extends SubscriptionArbiter<Integer> {

		Relay(Subscriber<? super Integer> actual) {
			super(actual);
		}

		@Override
		public void onNext(Integer t) {
			actual.onNext(t);
		}
	}
}
