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

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class SchedulerTaskTest {

	@Test
	public void runsOnceThenReportsDisposed() {
		AtomicInteger runs = new AtomicInteger();
		SchedulerTask task = new SchedulerTask(runs::incrementAndGet);

		task.run();
		task.run();

		assertThat(runs).hasValue(1);
		assertThat(task.isDisposed()).isTrue();
	}

	@Test
	public void disposedTaskSkipsRunAndCancelsFuture() {
		AtomicInteger runs = new AtomicInteger();
		SchedulerTask task = new SchedulerTask(runs::incrementAndGet);
		Future<?> future = mock(Future.class);
		task.setFuture(future);

		task.dispose();
		task.run();

		assertThat(runs).hasValue(0);
		verify(future).cancel(false);
	}

	@Test
	public void futureAttachedAfterDisposeIsCancelled() {
		SchedulerTask task = new SchedulerTask(() -> { });
		Future<?> future = mock(Future.class);

		task.dispose();
		task.setFuture(future);

		verify(future).cancel(false);
	}

	@Test
	public void disposeAfterRunLeavesFutureAlone() {
		SchedulerTask task = new SchedulerTask(() -> { });
		Future<?> future = mock(Future.class);
		task.setFuture(future);

		task.run();
		task.dispose();

		verify(future, never()).cancel(false);
	}
}
