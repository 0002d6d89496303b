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


package backflow.core.scheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.subscriber.TestSubscriber;

import backflow.core.Disposable;
import backflow.core.publisher.Flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.awaitility.Awaitility.await;

public class SchedulersTest {

	@AfterEach
	public void shutdownTimer() {
		Schedulers.shutdownNow();
	}

	@Test
	public void sharedTimerUsesConfiguredThreadName() throws InterruptedException {
		AtomicReference<String> threadName = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		Schedulers.timer().schedule(() -> {
			threadName.set(Thread.currentThread().getName());
			latch.countDown();
		}, 10, TimeUnit.MILLISECONDS);

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(Schedulers.DEFAULT_TIMER_NAME).isEqualTo("backflow-test-timer");
		assertThat(threadName.get()).startsWith("backflow-test-timer-");
	}

	@Test
	public void sharedTimerIsCachedAndIgnoresDispose() {
		Scheduler timer = Schedulers.timer();
		timer.dispose();

		assertThat(Schedulers.timer()).isSameAs(timer);
		assertThat(timer.isDisposed()).isFalse();
		assertThat(timer).hasToString("Schedulers.timer()");
	}

	@Test
	public void shutdownNowRecreatesTimer() {
		Scheduler first = Schedulers.timer();
		Schedulers.shutdownNow();

		assertThat(first.isDisposed()).isTrue();
		assertThat(Schedulers.timer()).isNotSameAs(first);
	}

	@Test
	public void disposedTaskDoesNotRun() throws InterruptedException {
		AtomicBoolean ran = new AtomicBoolean();

		Disposable task = Schedulers.timer().schedule(() -> ran.set(true), 200, TimeUnit.MILLISECONDS);
		task.dispose();
		assertThat(task.isDisposed()).isTrue();

		Thread.sleep(400);
		assertThat(ran).isFalse();
	}

	@Test
	public void newTimerRejectsAfterDispose() {
		Scheduler timer = Schedulers.newTimer("dedicated");
		timer.dispose();

		assertThat(timer.isDisposed()).isTrue();
		assertThatExceptionOfType(RejectedExecutionException.class)
				.isThrownBy(() -> timer.schedule(() -> { }));
	}

	@Test
	public void immediateRunsOnCallerAndCannotDelay() {
		AtomicReference<Thread> thread = new AtomicReference<>();

		Disposable d = Schedulers.immediate().schedule(() -> thread.set(Thread.currentThread()));

		assertThat(thread.get()).isSameAs(Thread.currentThread());
		assertThat(d.isDisposed()).isTrue();
		assertThatExceptionOfType(RejectedExecutionException.class)
				.isThrownBy(() -> Schedulers.immediate().schedule(() -> { }, 1, TimeUnit.SECONDS));
	}

	@Test
	public void delayOnRealTimer() {
		TestSubscriber<Long> ts = TestSubscriber.create();

		Flow.delay(Duration.ofMillis(50)).subscribe(ts);

		await().atMost(Duration.ofSeconds(5)).until(ts::isTerminated);
		assertThat(ts.getReceivedOnNext()).containsExactly(0L);
		assertThat(ts.isTerminatedComplete()).isTrue();
	}

	@Test
	public void failingTaskDoesNotKillTimer() {
		Scheduler timer = Schedulers.newTimer("failing", true);
		AtomicBoolean ran = new AtomicBoolean();
		try {
			timer.schedule(() -> {
				throw new IllegalStateException("task failed");
			});
			timer.schedule(() -> ran.set(true), 10, TimeUnit.MILLISECONDS);

			await().atMost(Duration.ofSeconds(5)).untilTrue(ran);
		}
		finally {
			timer.dispose();
		}
	}
}
