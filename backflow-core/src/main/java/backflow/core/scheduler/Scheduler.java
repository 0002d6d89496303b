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

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import backflow.core.Disposable;

/**
 * Provides an abstract asynchronous boundary to operators that need to defer work,
 * such as the timed sources of {@link backflow.core.publisher.Flow}.
 * <p>
 * Implementations that use an underlying {@link java.util.concurrent.ExecutorService}
 * or {@link java.util.concurrent.ScheduledExecutorService} should release it on
 * {@link #dispose()}.
 */
public interface Scheduler extends Disposable {

	/**
	 * Schedules the non-delayed execution of the given task on this scheduler.
	 *
	 * @param task the task to execute
	 *
	 * @return the {@link Disposable} instance that lets one cancel this particular task.
	 * @throws RejectedExecutionException if the scheduler has been disposed
	 */
	Disposable schedule(Runnable task);

	/**
	 * Schedules the execution of the given task with the given delay amount.
	 *
	 * @param task the task to schedule
	 * @param delay the delay amount, non-positive values indicate non-delayed scheduling
	 * @param unit the unit of measure of the delay amount
	 * @return the {@link Disposable} that lets one cancel this particular delayed task.
	 * @throws RejectedExecutionException if the scheduler is disposed or is not capable
	 * of delaying tasks
	 */
	default Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		throw new RejectedExecutionException("Scheduler is not capable of time-based scheduling");
	}

	/**
	 * Returns the "current time" notion of this scheduler.
	 *
	 * @param unit the target unit of the current time
	 * @return the current time value in the target unit of measure
	 */
	default long now(TimeUnit unit) {
		return unit.convert(System.currentTimeMillis(), TimeUnit.MILLISECONDS);
	}

	/**
	 * Instructs this Scheduler to release all resources and reject any new tasks to be
	 * executed. Tasks already scheduled may not run.
	 */
	@Override
	default void dispose() {
	}
}
