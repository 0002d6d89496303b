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
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;
import reactor.test.publisher.TestPublisher;
import reactor.test.subscriber.TestSubscriber;

import backflow.core.scheduler.VirtualTimer;

import static org.assertj.core.api.Assertions.assertThat;

public class FlowTimeoutFirstTest {

	final VirtualTimer timer = VirtualTimer.create();

	@Test
	public void timesOutWithoutFirstSignal() {
		TestPublisher<Integer> tp = TestPublisher.create();
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.from(tp)
		    .timeoutFirst(Duration.ofSeconds(5), () -> new TimeoutException("no device found"), timer)
		    .subscribe(ts);

		timer.advanceTimeBy(Duration.ofSeconds(4));
		assertThat(ts.isTerminated()).isFalse();

		timer.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(ts.expectTerminalError())
				.isInstanceOf(TimeoutException.class)
				.hasMessage("no device found");
		tp.assertCancelled();
	}

	@Test
	public void firstValueDisarmsTimer() {
		TestPublisher<Integer> tp = TestPublisher.create();
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.from(tp)
		    .timeoutFirst(Duration.ofSeconds(5), TimeoutException::new, timer)
		    .subscribe(ts);

		timer.advanceTimeBy(Duration.ofSeconds(3));
		tp.next(1);
		timer.advanceTimeBy(Duration.ofSeconds(10));
		tp.next(2);
		tp.complete();

		assertThat(ts.getReceivedOnNext()).containsExactly(1, 2);
		assertThat(ts.isTerminatedComplete()).isTrue();
		tp.assertNotCancelled();
	}

	@Test
	public void earlyCompletionDisarmsTimer() {
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.<Integer>empty()
		    .timeoutFirst(Duration.ofSeconds(1), TimeoutException::new, timer)
		    .subscribe(ts);
		timer.advanceTimeBy(Duration.ofSeconds(2));

		assertThat(ts.isTerminatedComplete()).isTrue();
	}

	@Test
	public void lateValueIsDropped() {
		TestPublisher<Integer> tp = TestPublisher.create();
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.from(tp)
		    .timeoutFirst(Duration.ofSeconds(1), TimeoutException::new, timer)
		    .subscribe(ts);
		timer.advanceTimeBy(Duration.ofSeconds(1));
		tp.next(1);

		assertThat(ts.getReceivedOnNext()).isEmpty();
		assertThat(ts.expectTerminalError()).isInstanceOf(TimeoutException.class);
	}

	@Test
	public void throwingSupplierFailsWithItsFailure() {
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.<Integer>never()
		    .timeoutFirst(Duration.ofSeconds(1), () -> {
			    throw new IllegalStateException("supplier failed");
		    }, timer)
		    .subscribe(ts);
		timer.advanceTimeBy(Duration.ofSeconds(1));

		assertThat(ts.expectTerminalError()).hasMessage("supplier failed");
	}

	@Test
	public void cancelDisposesTimer() {
		TestSubscriber<Integer> ts = TestSubscriber.create();

		Flow.<Integer>never()
		    .timeoutFirst(Duration.ofSeconds(1), TimeoutException::new, timer)
		    .subscribe(ts);
		ts.cancel();
		timer.advanceTimeBy(Duration.ofSeconds(2));

		assertThat(ts.isTerminated()).isFalse();
	}
}
