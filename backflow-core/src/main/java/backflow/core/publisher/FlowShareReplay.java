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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.concurrent.locks.ReentrantLock;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.util.Logger;
import backflow.util.Loggers;
import backflow.util.annotation.Nullable;

/**
 * Shares one upstream subscription among any number of subscribers and replays the
 * latest values to late ones.
 * <p>
 * The replay history, the set of attached subscribers, the stored terminal signal and
 * the current upstream connection are guarded by a single lock. Values are queued into
 * every subscriber's own {@link DemandBuffer} while holding it, and the buffers are
 * drained once it is released, so no subscriber code ever runs under the lock.
 *
 * @param <T> the value type
 */
final class FlowShareReplay<T> extends Flow<T> {

	static final Logger log = Loggers.getLogger(FlowShareReplay.class);

	final Publisher<? extends T> source;
	final int                    history;
	final ReplayScope            scope;

	final ReentrantLock lock = new ReentrantLock();

	final ArrayDeque<T>          replay = new ArrayDeque<>();
	final List<ReplayInner<T>>   inners = new ArrayList<>();
	@Nullable
	ReplayConnection<T> connection;
	boolean             terminated;
	@Nullable
	Throwable           failure;

	FlowShareReplay(Publisher<? extends T> source, int history, ReplayScope scope) {
		if (history <= 0) {
			throw new IllegalArgumentException("history > 0 required but it was " + history);
		}
		this.source = Objects.requireNonNull(source, "source");
		this.history = history;
		this.scope = Objects.requireNonNull(scope, "scope");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		ReplayInner<T> inner = new ReplayInner<>(actual, this);
		actual.onSubscribe(inner);

		ReplayConnection<T> toConnect = null;
		boolean replayTerminal = false;
		Throwable replayFailure = null;
		lock.lock();
		try {
			if (inner.buffer.isCancelled()) {
				return;
			}
			for (T v : replay) {
				inner.buffer.offer(v);
			}
			if (terminated) {
				replayTerminal = true;
				replayFailure = failure;
			}
			else {
				inners.add(inner);
				if (connection == null) {
					connection = new ReplayConnection<>(this);
					toConnect = connection;
				}
			}
		}
		finally {
			lock.unlock();
		}

		inner.buffer.drain();
		if (replayTerminal) {
			inner.deferTerminal(replayFailure);
		}

		if (toConnect != null) {
			if (log.isDebugEnabled()) {
				log.debug("Connecting to {}", source);
			}
			source.subscribe(toConnect);
		}
	}

	void relay(ReplayConnection<T> from, T value) {
		List<ReplayInner<T>> targets;
		lock.lock();
		try {
			if (from != connection) {
				targets = null;
			}
			else {
				replay.offer(value);
				if (replay.size() > history) {
					replay.poll();
				}
				targets = new ArrayList<>(inners);
				for (Iterator<ReplayInner<T>> it = inners.iterator(); it.hasNext(); ) {
					DemandBuffer<T> b = it.next().buffer;
					if (b.isCancelled() || !b.offer(value)) {
						it.remove();
					}
				}
			}
		}
		finally {
			lock.unlock();
		}

		if (targets == null) {
			Operators.onNextDropped(value);
			return;
		}
		for (ReplayInner<T> inner : targets) {
			inner.buffer.drain();
		}
		disconnectIfUnused();
	}

	void complete(ReplayConnection<T> from, @Nullable Throwable error) {
		List<ReplayInner<T>> targets;
		lock.lock();
		try {
			if (from != connection) {
				targets = null;
			}
			else {
				connection = null;
				targets = new ArrayList<>(inners);
				inners.clear();
				for (ReplayInner<T> inner : targets) {
					inner.buffer.terminate(error);
				}
				if (scope == ReplayScope.FOREVER) {
					terminated = true;
					failure = error;
				}
				else {
					replay.clear();
				}
			}
		}
		finally {
			lock.unlock();
		}

		if (targets == null) {
			if (error != null) {
				Operators.onErrorDropped(error);
			}
			return;
		}
		for (ReplayInner<T> inner : targets) {
			inner.buffer.drain();
		}
	}

	void remove(ReplayInner<T> inner) {
		lock.lock();
		try {
			if (!inners.remove(inner)) {
				return;
			}
		}
		finally {
			lock.unlock();
		}
		disconnectIfUnused();
	}

	/**
	 * A {@link ReplayScope#WHILE_CONNECTED} share drops its connection and history
	 * once the last subscriber leaves.
	 */
	void disconnectIfUnused() {
		if (scope != ReplayScope.WHILE_CONNECTED) {
			return;
		}
		ReplayConnection<T> toDispose;
		lock.lock();
		try {
			if (!inners.isEmpty() || connection == null) {
				return;
			}
			toDispose = connection;
			connection = null;
			replay.clear();
		}
		finally {
			lock.unlock();
		}
		if (log.isDebugEnabled()) {
			log.debug("Disconnecting from {}", source);
		}
		toDispose.dispose();
	}

	/**
	 * A subscriber's view of the share. A subscriber that arrives after the upstream
	 * terminated gets the stored terminal signal on its first request, once the
	 * replayed values that request covers have been delivered.
	 */
	static final class ReplayInner<T> implements Subscription {

		static final int NO_TERMINAL  = 0;
		static final int DEFERRED     = 1;
		static final int DELIVERED    = 2;

		final DemandBuffer<T>       buffer;
		final FlowShareReplay<T>    parent;

		volatile boolean requested;

		@Nullable
		Throwable deferredFailure;
		volatile int terminal;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<ReplayInner> TERMINAL =
				AtomicIntegerFieldUpdater.newUpdater(ReplayInner.class, "terminal");

		ReplayInner(Subscriber<? super T> actual, FlowShareReplay<T> parent) {
			this.buffer = new DemandBuffer<>(actual);
			this.parent = parent;
		}

		void deferTerminal(@Nullable Throwable failure) {
			deferredFailure = failure;
			terminal = DEFERRED;
			if (requested) {
				releaseTerminal();
			}
		}

		void releaseTerminal() {
			if (TERMINAL.compareAndSet(this, DEFERRED, DELIVERED)) {
				buffer.complete(deferredFailure);
			}
		}

		@Override
		public void request(long n) {
			buffer.request(n);
			requested = true;
			if (terminal == DEFERRED) {
				releaseTerminal();
			}
		}

		@Override
		public void cancel() {
			if (!buffer.isCancelled()) {
				buffer.cancel();
				parent.remove(this);
			}
		}
	}

	static final class ReplayConnection<T> implements Subscriber<T> {

		final FlowShareReplay<T> parent;

		volatile Subscription s;
		@SuppressWarnings("rawtypes")
		static final AtomicReferenceFieldUpdater<ReplayConnection, Subscription> S =
				AtomicReferenceFieldUpdater.newUpdater(ReplayConnection.class, Subscription.class, "s");

		ReplayConnection(FlowShareReplay<T> parent) {
			this.parent = parent;
		}

		@Override
		public void onSubscribe(Subscription s) {
			if (Operators.setOnce(S, this, s)) {
				s.request(Long.MAX_VALUE);
			}
		}

		@Override
		public void onNext(T t) {
			parent.relay(this, t);
		}

		@Override
		public void onError(Throwable t) {
			parent.complete(this, t);
		}

		@Override
		public void onComplete() {
			parent.complete(this, null);
		}

		void dispose() {
			Operators.terminate(S, this);
		}
	}
}
