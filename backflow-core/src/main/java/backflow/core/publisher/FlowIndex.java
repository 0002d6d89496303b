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

import backflow.util.function.Tuple2;
import backflow.util.function.Tuples;

/**
 * Pairs each value with its position, counted from 0 for every subscription.
 *
 * @param <T> the value type
 */
final class FlowIndex<T> extends Flow<Tuple2<Long, T>> {

	final Publisher<? extends T> source;

	FlowIndex(Publisher<? extends T> source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	@Override
	protected void subscribeActual(Subscriber<? super Tuple2<Long, T>> actual) {
		IndexSubscriber<T> sink = new IndexSubscriber<>(actual);
		actual.onSubscribe(sink);
		source.subscribe(sink);
	}

	static final class IndexSubscriber<T> extends DemandSink<T, Tuple2<Long, T>> {

		long index;

		IndexSubscriber(Subscriber<? super Tuple2<Long, T>> actual) {
			super(actual);
		}

		@Override
		public void onNext(T t) {
			if (isDone()) {
				Operators.onNextDropped(t);
				return;
			}
			emit(Tuples.of(index++, t));
		}
	}
}
