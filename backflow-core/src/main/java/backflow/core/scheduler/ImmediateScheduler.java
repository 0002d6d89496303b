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

import backflow.core.Disposable;

/**
 * Runs tasks synchronously on the calling thread. Delayed scheduling is rejected.
 */
final class ImmediateScheduler implements Scheduler {

	static final ImmediateScheduler INSTANCE = new ImmediateScheduler();

	static final Disposable FINISHED = new Disposable() {
		@Override
		public void dispose() {
		}

		@Override
		public boolean isDisposed() {
			return true;
		}
	};

	private ImmediateScheduler() {
	}

	@Override
	public Disposable schedule(Runnable task) {
		task.run();
		return FINISHED;
	}

	@Override
	public String toString() {
		return "Schedulers.immediate()";
	}
}
