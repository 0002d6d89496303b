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
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.Test;
import reactor.test.subscriber.TestSubscriber;

import backflow.core.scheduler.Scheduler;
import backflow.core.scheduler.Schedulers;
import backflow.core.scheduler.VirtualTimer;

import static org.assertj.core.api.Assertions.assertThat;

public class FlowDelayedTest {

	final VirtualTimer timer = VirtualTimer.create();

	@Test
	public void delayEmitsZeroThenCompletes() {
		TestSubscriber<Long> ts = TestSubscriber.create();

		Flow.delay(Duration.ofMillis(100), timer).subscribe(ts);
		timer.advanceTimeBy(Duration.ofMillis(99));
		assertThat(ts.getReceivedOnNext()).isEmpty();

		timer.advanceTimeBy(Duration.ofMillis(1));
		assertThat(ts.getReceivedOnNext()).containsExactly(0L);
		assertThat(ts.isTerminatedComplete()).isTrue();
	}

	@Test
	public void delayedValueWaitsForDemand() {
		TestSubscriber<String> ts = TestSubscriber.builder().initialRequest(0).build();

		Flow.delayedJust("late", Duration.ofSeconds(1), timer).subscribe(ts);
		timer.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(ts.isTerminated()).isFalse();

		ts.request(1);
		assertThat(ts.getReceivedOnNext()).containsExactly("late");
		assertThat(ts.isTerminatedComplete()).isTrue();
	}

	@Test
	public void delayedErrorFailsAfterDelay() {
		TestSubscriber<String> ts = TestSubscriber.builder().initialRequest(0).build();

		Flow.<String>delayedError(new IllegalStateException("disconnected"), Duration.ofSeconds(2), timer)
		    .subscribe(ts);
		timer.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(ts.isTerminated()).isFalse();

		timer.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(ts.expectTerminalError()).hasMessage("disconnected");
	}

	@Test
	public void cancelBeforeDelayEmitsNothing() {
		TestSubscriber<Long> ts = TestSubscriber.create();

		Flow.delay(Duration.ofSeconds(1), timer).subscribe(ts);
		ts.cancel();
		timer.advanceTimeBy(Duration.ofSeconds(5));

		assertThat(ts.getReceivedOnNext()).isEmpty();
		assertThat(ts.isTerminated()).isFalse();
	}

	@Test
	public void rejectedSchedulingFails() {
		ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
		executor.shutdown();
		Scheduler closed = Schedulers.fromExecutorService(executor);
		TestSubscriber<Long> ts = TestSubscriber.create();

		Flow.delay(Duration.ofSeconds(1), closed).subscribe(ts);

		assertThat(ts.expectTerminalError()).isInstanceOf(RejectedExecutionException.class);
	}

	@Test
	public void immediateSchedulerCannotDelay() {
		TestSubscriber<Long> ts = TestSubscriber.create();

		Flow.delay(Duration.ofSeconds(1), Schedulers.immediate()).subscribe(ts);

		assertThat(ts.expectTerminalError()).isInstanceOf(RejectedExecutionException.class);
	}
}
