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

import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import backflow.core.Disposable;
import backflow.core.Exceptions;

/**
 * A {@link Scheduler} running tasks on a {@link ScheduledExecutorService}. Disposing the
 * scheduler shuts the executor down.
 */
final class ExecutorServiceScheduler implements Scheduler {

	final ScheduledExecutorService executor;
	final String                   name;

	ExecutorServiceScheduler(ScheduledExecutorService executor, String name) {
		this.executor = Objects.requireNonNull(executor, "executor");
		this.name = name;
	}

	@Override
	public Disposable schedule(Runnable task) {
		return schedule(task, 0L, TimeUnit.MILLISECONDS);
	}

	@Override
	public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		SchedulerTask sr = new SchedulerTask(Objects.requireNonNull(task, "task"));
		Future<?> f;
		try {
			if (delay <= 0L) {
				f = executor.submit(sr);
			}
			else {
				f = executor.schedule(sr, delay, unit);
			}
		}
		catch (RejectedExecutionException ree) {
			throw Exceptions.failWithRejected(ree);
		}
		sr.setFuture(f);
		return sr;
	}

	@Override
	public boolean isDisposed() {
		return executor.isShutdown();
	}

	@Override
	public void dispose() {
		executor.shutdownNow();
	}

	@Override
	public String toString() {
		return "ExecutorServiceScheduler{" + name + "}";
	}
}
