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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Names the threads it creates {@code name-N}, optionally as daemons, and reports
 * uncaught exceptions through {@link Schedulers#defaultUncaughtException(Thread, Throwable)}.
 */
final class TimerThreadFactory implements ThreadFactory, Thread.UncaughtExceptionHandler {

	final String     name;
	final AtomicLong counterReference;
	final boolean    daemon;

	TimerThreadFactory(String name, AtomicLong counterReference, boolean daemon) {
		this.name = name;
		this.counterReference = counterReference;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread t = new Thread(runnable, name + "-" + counterReference.incrementAndGet());
		t.setDaemon(daemon);
		t.setUncaughtExceptionHandler(this);
		return t;
	}

	@Override
	public void uncaughtException(Thread t, Throwable e) {
		Schedulers.defaultUncaughtException(t, e);
	}

	@Override
	public String toString() {
		return name;
	}
}
