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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.publisher.TestPublisher;
import reactor.test.subscriber.TestSubscriber;

import static org.assertj.core.api.Assertions.assertThat;

public class FlowRetryWhenTest {

	static Flow<String> failingTimes(AtomicInteger attempts, int failures) {
		return Flow.defer(() -> {
			int attempt = attempts.incrementAndGet();
			if (attempt <= failures) {
				return Flow.error(new IOException("attempt " + attempt));
			}
			return Flow.just("success");
		});
	}

	@Test
	public void failingOnceThenSucceedingShowsNoFailure() {
		AtomicInteger attempts = new AtomicInteger();

		StepVerifier.create(failingTimes(attempts, 1).retryWhen(failures -> failures))
		            .expectNext("success")
		            .verifyComplete();

		assertThat(attempts).hasValue(2);
	}

	@Test
	public void unconditionalRetrySucceedsOnFourthAttempt() {
		AtomicInteger attempts = new AtomicInteger();

		StepVerifier.create(failingTimes(attempts, 3).retryWhen(failures -> failures.map(e -> "retry")))
		            .expectNext("success")
		            .verifyComplete();

		assertThat(attempts).hasValue(4);
	}

	@Test
	public void handlerRethrowingStopsOnFirstOccurrence() {
		AtomicInteger attempts = new AtomicInteger();
		Flow<String> source = Flow.defer(() -> {
			attempts.incrementAndGet();
			return Flow.error(new IllegalArgumentException("fatal"));
		});

		StepVerifier.create(source.retryWhen(failures -> failures.map(e -> {
			            if (e instanceof IllegalArgumentException) {
				            throw (IllegalArgumentException) e;
			            }
			            return e;
		            })))
		            .verifyErrorSatisfies(e -> assertThat(e).isInstanceOf(IllegalArgumentException.class)
		                                                    .hasMessage("fatal"));

		assertThat(attempts).hasValue(1);
	}

	@Test
	public void companionFailureTerminatesAfterBoundedRetries() {
		AtomicInteger attempts = new AtomicInteger();
		AtomicInteger retries = new AtomicInteger();

		StepVerifier.create(failingTimes(attempts, 10).retryWhen(failures -> failures.map(e -> {
			            if (retries.incrementAndGet() > 2) {
				            throw new IllegalStateException("gave up", e);
			            }
			            return e;
		            })))
		            .verifyErrorSatisfies(e -> assertThat(e).hasMessage("gave up")
		                                                    .hasCauseInstanceOf(IOException.class));

		assertThat(attempts).hasValue(3);
	}

	@Test
	public void companionCompletionCompletesWithoutSubscribingSource() {
		AtomicInteger attempts = new AtomicInteger();

		StepVerifier.create(failingTimes(attempts, 1).retryWhen(failures -> Flow.empty()))
		            .verifyComplete();

		assertThat(attempts).hasValue(0);
	}

	@Test
	public void sourceCompletionIsNeverRetried() {
		AtomicInteger attempts = new AtomicInteger();

		StepVerifier.create(failingTimes(attempts, 0).retryWhen(failures -> failures))
		            .expectNext("success")
		            .verifyComplete();

		assertThat(attempts).hasValue(1);
	}

	@Test
	public void unconsumedDemandCarriesOverToNextAttempt() {
		TestPublisher<Integer> first = TestPublisher.create();
		TestPublisher<Integer> second = TestPublisher.create();
		AtomicInteger attempts = new AtomicInteger();
		Flow<Integer> source = Flow.defer(() -> attempts.incrementAndGet() == 1 ? first : second);

		StepVerifier.create(source.retryWhen(failures -> failures), 3)
		            .then(() -> first.next(1, 2))
		            .then(() -> first.error(new IllegalStateException("retry me")))
		            .then(() -> second.assertMinRequested(1).assertMaxRequested(1))
		            .then(() -> second.next(3))
		            .then(second::complete)
		            .expectNext(1, 2, 3)
		            .verifyComplete();
	}

	@Test
	public void cancelTearsDownSourceAndCompanion() {
		TestPublisher<Integer> source = TestPublisher.create();
		TestPublisher<Object> companion = TestPublisher.create();
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.from(source).retryWhen(failures -> companion).subscribe(ts);
		source.assertSubscribers(1);
		companion.assertSubscribers(1);

		ts.cancel();

		source.assertCancelled();
		companion.assertCancelled();
	}

	@Test
	public void companionIsRequestedOnePerFailure() {
		List<Throwable> unobserved = new ArrayList<>();
		Hooks.onErrorDropped(unobserved::add);
		try {
			AtomicInteger attempts = new AtomicInteger();
			TestPublisher<Object> companion = TestPublisher.create();
			TestSubscriber<String> ts = TestSubscriber.create();

			failingTimes(attempts, 5).retryWhen(failures -> companion).subscribe(ts);

			assertThat(attempts).hasValue(1);
			companion.assertMinRequested(1).assertMaxRequested(1);

			companion.next("go");

			assertThat(attempts).hasValue(2);
			companion.assertMinRequested(1).assertMaxRequested(1);
			assertThat(ts.isTerminated()).isFalse();
			assertThat(unobserved).as("nobody listens to the failures").hasSize(2);
		}
		finally {
			Hooks.resetOnErrorDropped();
		}
	}

	@Test
	public void failuresAcceptOnlyOneSubscriber() {
		StepVerifier.create(Flow.<Integer>never().retryWhen(failures -> failures.absorb(failures)))
		            .verifyErrorSatisfies(e -> assertThat(e).isInstanceOf(IllegalStateException.class)
		                                                    .hasMessageContaining("only one Subscriber"));
	}

	@Test
	public void throwingFactoryFails() {
		StepVerifier.create(Flow.just(1).retryWhen(failures -> {
			            throw new IllegalStateException("no companion");
		            }))
		            .verifyErrorMessage("no companion");
	}
}
