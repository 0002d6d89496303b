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

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import backflow.util.annotation.Nullable;

/**
 * Turns values and the terminal signal into {@link Event events}, then completes.
 *
 * @param <T> the value type
 */
final class FlowMaterialize<T> extends Flow<Event<T>> {

	final Publisher<? extends T> source;

	FlowMaterialize(Publisher<? extends T> source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	@Override
	protected void subscribeActual(Subscriber<? super Event<T>> actual) {
		MaterializeSubscriber<T> sink = new MaterializeSubscriber<>(actual);
		actual.onSubscribe(sink);
		source.subscribe(sink);
	}

	static final class MaterializeSubscriber<T> extends DemandSink<T, Event<T>> {

		MaterializeSubscriber(Subscriber<? super Event<T>> actual) {
			super(actual, Event::value, null);
		}

		/**
		 * The terminal signal becomes the last event. The completion is held back until
		 * that event has been delivered.
		 */
		@Override
		protected void terminate(@Nullable Throwable failure) {
			buffer.bufferLast(failure == null ? Event.finished() : Event.failure(failure));
		}
	}
}
