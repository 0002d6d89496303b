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
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import backflow.core.Disposable;
import backflow.core.Exceptions;
import backflow.util.Logger;
import backflow.util.Loggers;

/**
 * {@link Schedulers} provides various {@link Scheduler} flavors usable by the timed
 * operators of {@link backflow.core.publisher.Flow}.
 * <ul>
 *     <li>{@link #timer()}: a shared single daemon thread, the default for timed operators.
 *     Its thread name prefix is read from the {@value #TIMER_NAME_PROPERTY} system
 *     property.</li>
 *     <li>{@link #newTimer(String)}: a dedicated single-thread timer.</li>
 *     <li>{@link #fromExecutorService(ScheduledExecutorService)}: adapts an existing
 *     executor.</li>
 *     <li>{@link #immediate()}: runs non-delayed tasks on the caller thread.</li>
 * </ul>
 */
public abstract class Schedulers {

	/**
	 * The system property naming the threads of the shared {@link #timer()}.
	 */
	public static final String TIMER_NAME_PROPERTY = "backflow.schedulers.timer.name";

	/**
	 * Thread name prefix of the shared {@link #timer()}, {@code backflow-timer} unless
	 * configured through {@value #TIMER_NAME_PROPERTY}.
	 */
	public static final String DEFAULT_TIMER_NAME =
			System.getProperty(TIMER_NAME_PROPERTY, "backflow-timer");

	static final AtomicReference<CachedScheduler> CACHED_TIMER = new AtomicReference<>();

	static final AtomicLong COUNTER = new AtomicLong();

	/**
	 * The shared timer, created lazily on first use and recreated after
	 * {@link #shutdownNow()}. Calling {@link Scheduler#dispose()} on it has no effect.
	 *
	 * @return the shared timer {@link Scheduler}
	 */
	public static Scheduler timer() {
		for (;;) {
			CachedScheduler s = CACHED_TIMER.get();
			if (s != null) {
				return s;
			}
			CachedScheduler created = new CachedScheduler("timer", newTimer(DEFAULT_TIMER_NAME, true));
			if (CACHED_TIMER.compareAndSet(null, created)) {
				log.debug("Created shared timer {}", DEFAULT_TIMER_NAME);
				return created;
			}
			created.cached.dispose();
		}
	}

	/**
	 * Create a dedicated single-thread timer backed by non-daemon threads.
	 *
	 * @param name the thread name prefix
	 * @return a new {@link Scheduler}, to be disposed when no longer needed
	 */
	public static Scheduler newTimer(String name) {
		return newTimer(name, false);
	}

	/**
	 * Create a dedicated single-thread timer.
	 *
	 * @param name the thread name prefix
	 * @param daemon whether the backing thread is a daemon thread
	 * @return a new {@link Scheduler}, to be disposed when no longer needed
	 */
	public static Scheduler newTimer(String name, boolean daemon) {
		Objects.requireNonNull(name, "name");
		ScheduledThreadPoolExecutor e = (ScheduledThreadPoolExecutor) Executors.newScheduledThreadPool(1,
				new TimerThreadFactory(name, COUNTER, daemon));
		e.setRemoveOnCancelPolicy(true);
		e.setMaximumPoolSize(1);
		return new ExecutorServiceScheduler(e, name);
	}

	/**
	 * Adapt a {@link ScheduledExecutorService}. Disposing the returned scheduler shuts
	 * the executor down.
	 *
	 * @param executorService the executor to run tasks on
	 * @return a {@link Scheduler} backed by the given executor
	 */
	public static Scheduler fromExecutorService(ScheduledExecutorService executorService) {
		return new ExecutorServiceScheduler(executorService, executorService.toString());
	}

	/**
	 * @return a {@link Scheduler} running non-delayed tasks immediately on the caller thread
	 */
	public static Scheduler immediate() {
		return ImmediateScheduler.INSTANCE;
	}

	/**
	 * Dispose the shared {@link #timer()}. Pending delayed tasks are dropped and the next
	 * call to {@link #timer()} creates a fresh one.
	 */
	public static void shutdownNow() {
		CachedScheduler s = CACHED_TIMER.getAndSet(null);
		if (s != null) {
			log.debug("Disposing shared timer {}", DEFAULT_TIMER_NAME);
			s.cached.dispose();
		}
	}

	static void defaultUncaughtException(Thread t, Throwable e) {
		log.error("Scheduler worker " + t.getName() + " failed with an uncaught exception", e);
	}

	/**
	 * Report an error thrown by a scheduled task to the current thread's
	 * {@link Thread.UncaughtExceptionHandler}, or log it if there is none.
	 *
	 * @param ex the error thrown by the task
	 */
	static void handleError(Throwable ex) {
		Thread thread = Thread.currentThread();
		Throwable t = Exceptions.unwrap(ex);
		Thread.UncaughtExceptionHandler x = thread.getUncaughtExceptionHandler();
		if (x != null) {
			x.uncaughtException(thread, t);
		}
		else {
			log.error("Scheduler worker failed with an uncaught exception", t);
		}
	}

	Schedulers() {
	}

	static final class CachedScheduler implements Scheduler {

		final Scheduler cached;
		final String    stringRepresentation;

		CachedScheduler(String key, Scheduler cached) {
			this.cached = cached;
			this.stringRepresentation = "Schedulers." + key + "()";
		}

		@Override
		public Disposable schedule(Runnable task) {
			return cached.schedule(task);
		}

		@Override
		public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
			return cached.schedule(task, delay, unit);
		}

		@Override
		public long now(TimeUnit unit) {
			return cached.now(unit);
		}

		@Override
		public void dispose() {
		}

		@Override
		public boolean isDisposed() {
			return cached.isDisposed();
		}

		@Override
		public String toString() {
			return stringRepresentation;
		}
	}

	static final Logger log = Loggers.getLogger(Schedulers.class);
}
