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
import reactor.test.StepVerifier;
import reactor.test.publisher.PublisherProbe;
import reactor.test.publisher.TestPublisher;
import reactor.test.subscriber.TestSubscriber;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

public class FlowReplaceEmptyTest {

	@Test
	public void alternativeNull() {
		assertThatNullPointerException().isThrownBy(() -> Flow.never().replaceEmptyWith(null));
	}

	@Test
	public void nonEmptyIgnoresAlternative() {
		PublisherProbe<Integer> alternative = PublisherProbe.of(Flow.just(10));

		StepVerifier.create(Flow.just(1, 2, 3).replaceEmptyWith(alternative.flux()))
		            .expectNext(1, 2, 3)
		            .verifyComplete();

		alternative.assertWasNotSubscribed();
	}

	@Test
	public void emptySwitchesToAlternative() {
		StepVerifier.create(Flow.<Integer>empty().replaceEmptyWith(Flow.just(10, 20)))
		            .expectNext(10, 20)
		            .verifyComplete();
	}

	@Test
	public void emptyBackpressured() {
		TestSubscriber<Integer> ts = TestSubscriber.builder().initialRequest(0).build();

		Flow.<Integer>empty().replaceEmptyWith(Flow.just(10, 20)).subscribe(ts);
		assertThat(ts.getReceivedOnNext()).isEmpty();
		assertThat(ts.isTerminated()).isFalse();

		ts.request(1);
		assertThat(ts.getReceivedOnNext()).containsExactly(10);

		ts.request(1);
		assertThat(ts.getReceivedOnNext()).containsExactly(10, 20);
		assertThat(ts.isTerminatedComplete()).isTrue();
	}

	@Test
	public void demandCarriesOverToAlternative() {
		TestPublisher<Integer> source = TestPublisher.create();
		TestPublisher<Integer> alternative = TestPublisher.create();

		StepVerifier.create(Flow.from(source).replaceEmptyWith(alternative), 5)
		            .then(source::complete)
		            .then(() -> alternative.assertMinRequested(5))
		            .then(() -> alternative.next(1))
		            .then(alternative::complete)
		            .expectNext(1)
		            .verifyComplete();
	}

	@Test
	public void failureDoesNotTriggerAlternative() {
		PublisherProbe<Integer> alternative = PublisherProbe.empty();

		StepVerifier.create(Flow.<Integer>error(new IllegalStateException("boom"))
		                        .replaceEmptyWith(alternative.flux()))
		            .verifyErrorMessage("boom");

		alternative.assertWasNotSubscribed();
	}

	@Test
	public void replaceEmptyWithError() {
		StepVerifier.create(Flow.empty().replaceEmptyWithError(new IllegalStateException("nothing found")))
		            .verifyErrorMessage("nothing found");
	}

	@Test
	public void cancelCancelsActiveSide() {
		TestPublisher<Integer> source = TestPublisher.create();
		TestPublisher<Integer> alternative = TestPublisher.create();
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.from(source).replaceEmptyWith(alternative).subscribe(ts);
		source.complete();
		ts.cancel();

		alternative.assertCancelled();
	}
}
