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
import java.util.concurrent.TimeUnit;

import reactor.test.scheduler.VirtualTimeScheduler;

import backflow.core.Disposable;

/**
 * A {@link Scheduler} driven by a reactor-test {@link VirtualTimeScheduler}, so that
 * timed operators can be tested without waiting.
 */
public final class VirtualTimer implements Scheduler {

	public static VirtualTimer create() {
		return new VirtualTimer(VirtualTimeScheduler.create());
	}

	final VirtualTimeScheduler virtualTime;

	VirtualTimer(VirtualTimeScheduler virtualTime) {
		this.virtualTime = virtualTime;
	}

	public void advanceTimeBy(Duration duration) {
		virtualTime.advanceTimeBy(duration);
	}

	@Override
	public Disposable schedule(Runnable task) {
		return adapt(virtualTime.schedule(task));
	}

	@Override
	public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		return adapt(virtualTime.schedule(task, delay, unit));
	}

	@Override
	public long now(TimeUnit unit) {
		return virtualTime.now(unit);
	}

	@Override
	public void dispose() {
		virtualTime.dispose();
	}

	@Override
	public boolean isDisposed() {
		return virtualTime.isDisposed();
	}

	static Disposable adapt(reactor.core.Disposable d) {
		return new Disposable() {
			@Override
			public void dispose() {
				d.dispose();
			}

			@Override
			public boolean isDisposed() {
				return d.isDisposed();
			}
		};
	}
}
