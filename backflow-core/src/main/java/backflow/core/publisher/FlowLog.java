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

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.util.Logger;
import backflow.util.Loggers;
import backflow.util.annotation.Nullable;

/**
 * Logs every signal passing through, on a {@link Logger} of the given category.
 *
 * @param <T> the value type
 */
final class FlowLog<T> extends Flow<T> {

	static final String LOG_TEMPLATE = "{}{}({})";

	final Publisher<? extends T> source;

	final Logger log;

	final Level level;

	final AtomicLong uniqueId = new AtomicLong();

	FlowLog(Publisher<? extends T> source, @Nullable String category, Level level) {
		this.source = Objects.requireNonNull(source, "source");
		this.level = Objects.requireNonNull(level, "level");
		this.log = category != null && !category.isEmpty() ? Loggers.getLogger(category) :
				Loggers.getLogger(FlowLog.class);
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		long id = uniqueId.incrementAndGet();
		source.subscribe(new LogSubscriber<>(this, id, actual));
	}

	@Override
	public String toString() {
		return "/loggers/" + (log.getName()
		                         .equalsIgnoreCase(FlowLog.class.getName()) ? "default" : log.getName());
	}

	static final class LogSubscriber<T> implements Subscriber<T>, Subscription {

		final FlowLog<T>            parent;
		final long                  id;
		final Subscriber<? super T> actual;

		Subscription s;

		LogSubscriber(FlowLog<T> parent, long id, Subscriber<? super T> actual) {
			this.parent = parent;
			this.id = id;
			this.actual = actual;
		}

		String prefix() {
			return id == 1L ? "" : "[" + id + "].";
		}

		boolean enabled() {
			Logger log = parent.log;
			int l = parent.level.intValue();
			if (l >= Level.SEVERE.intValue()) {
				return log.isErrorEnabled();
			}
			if (l >= Level.WARNING.intValue()) {
				return log.isWarnEnabled();
			}
			if (l >= Level.INFO.intValue()) {
				return log.isInfoEnabled();
			}
			if (l >= Level.FINE.intValue()) {
				return log.isDebugEnabled();
			}
			return log.isTraceEnabled();
		}

		void log(String signal, Object detail) {
			if (!enabled()) {
				return;
			}
			Logger log = parent.log;
			int l = parent.level.intValue();
			if (l >= Level.SEVERE.intValue()) {
				log.error(LOG_TEMPLATE, prefix(), signal, detail);
			}
			else if (l >= Level.WARNING.intValue()) {
				log.warn(LOG_TEMPLATE, prefix(), signal, detail);
			}
			else if (l >= Level.INFO.intValue()) {
				log.info(LOG_TEMPLATE, prefix(), signal, detail);
			}
			else if (l >= Level.FINE.intValue()) {
				log.debug(LOG_TEMPLATE, prefix(), signal, detail);
			}
			else {
				log.trace(LOG_TEMPLATE, prefix(), signal, detail);
			}
		}

		@Override
		public void onSubscribe(Subscription s) {
			if (Operators.validate(this.s, s)) {
				this.s = s;
				log("onSubscribe", s);
				actual.onSubscribe(this);
			}
		}

		@Override
		public void onNext(T t) {
			log("onNext", t);
			actual.onNext(t);
		}

		@Override
		public void onError(Throwable t) {
			Logger log = parent.log;
			if (log.isErrorEnabled()) {
				log.error(LOG_TEMPLATE, prefix(), "onError", t);
				log.error(prefix(), t);
			}
			actual.onError(t);
		}

		@Override
		public void onComplete() {
			log("onComplete", "");
			actual.onComplete();
		}

		@Override
		public void request(long n) {
			log("request", n == Long.MAX_VALUE ? "unbounded" : n);
			s.request(n);
		}

		@Override
		public void cancel() {
			log("cancel", "");
			s.cancel();
		}
	}
}
