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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import backflow.core.Disposable;
import backflow.util.annotation.Nullable;

/**
 * A task handed to an executor. It runs at most once and not at all when disposed
 * first. Disposing it while it runs on another thread interrupts that thread. Errors
 * thrown by the task go to {@link Schedulers#handleError(Throwable)}.
 */
final class SchedulerTask implements Runnable, Disposable {

	static final int WAITING  = 0;
	static final int RUNNING  = 1;
	static final int DONE     = 2;
	static final int DISPOSED = 3;

	final Runnable task;

	volatile int state;
	static final AtomicIntegerFieldUpdater<SchedulerTask> STATE =
			AtomicIntegerFieldUpdater.newUpdater(SchedulerTask.class, "state");

	@Nullable
	volatile Future<?> future;

	@Nullable
	volatile Thread runner;

	SchedulerTask(Runnable task) {
		this.task = task;
	}

	@Override
	public void run() {
		if (!STATE.compareAndSet(this, WAITING, RUNNING)) {
			return;
		}
		runner = Thread.currentThread();
		try {
			task.run();
		}
		catch (Throwable ex) {
			Schedulers.handleError(ex);
		}
		finally {
			runner = null;
			STATE.compareAndSet(this, RUNNING, DONE);
		}
	}

	/**
	 * Attach the executor's handle, cancelling it at once if the task was disposed
	 * in the meantime.
	 */
	void setFuture(Future<?> f) {
		future = f;
		if (state == DISPOSED) {
			f.cancel(false);
		}
	}

	@Override
	public boolean isDisposed() {
		return state >= DONE;
	}

	@Override
	public void dispose() {
		for (;;) {
			int s = state;
			if (s >= DONE) {
				return;
			}
			if (STATE.compareAndSet(this, s, DISPOSED)) {
				Future<?> f = future;
				if (f != null) {
					Thread t = runner;
					f.cancel(s == RUNNING && t != null && t != Thread.currentThread());
				}
				return;
			}
		}
	}

	@Override
	public String toString() {
		return "SchedulerTask{" + task + "}";
	}
}
