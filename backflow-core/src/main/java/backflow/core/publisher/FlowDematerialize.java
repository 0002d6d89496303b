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

/**
 * Turns {@link Event events} back into signals. A terminal event cancels the source.
 *
 * @param <T> the value type
 */
final class FlowDematerialize<T> extends Flow<T> {

	final Publisher<Event<T>> source;

	FlowDematerialize(Publisher<Event<T>> source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		DematerializeSubscriber<T> sink = new DematerializeSubscriber<>(actual);
		actual.onSubscribe(sink);
		source.subscribe(sink);
	}

	static final class DematerializeSubscriber<T> extends DemandSink<Event<T>, T> {

		DematerializeSubscriber(Subscriber<? super T> actual) {
			super(actual);
		}

		@Override
		public void onNext(Event<T> event) {
			if (isDone()) {
				Operators.onNextDropped(event);
				return;
			}
			switch (event.getType()) {
				case VALUE:
					emit(Objects.requireNonNull(event.getValue()));
					break;
				case FAILURE:
					done = true;
					cancelUpstream();
					terminate(event.getFailure());
					break;
				default:
					done = true;
					cancelUpstream();
					terminate(null);
			}
		}
	}
}
