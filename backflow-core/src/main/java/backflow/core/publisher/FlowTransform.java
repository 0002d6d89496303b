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
import java.util.function.Function;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import backflow.util.annotation.Nullable;

/**
 * Relays a source through a {@link DemandSink} with value and failure transforms. This
 * backs {@link Flow#map(Function)}, {@link Flow#filter(java.util.function.Predicate)},
 * {@link Flow#values()} and {@link Flow#failures()}.
 *
 * @param <I> the source value type
 * @param <O> the output value type
 */
final class FlowTransform<I, O> extends Flow<O> {

	final Publisher<? extends I> source;

	final Function<? super I, ? extends O> valueTransform;

	@Nullable
	final Function<? super Throwable, ? extends Throwable> failureTransform;

	FlowTransform(Publisher<? extends I> source,
			Function<? super I, ? extends O> valueTransform,
			@Nullable Function<? super Throwable, ? extends Throwable> failureTransform) {
		this.source = Objects.requireNonNull(source, "source");
		this.valueTransform = Objects.requireNonNull(valueTransform, "valueTransform");
		this.failureTransform = failureTransform;
	}

	@Override
	protected void subscribeActual(Subscriber<? super O> actual) {
		DemandSink<I, O> sink = new DemandSink<>(actual, valueTransform, failureTransform);
		actual.onSubscribe(sink);
		source.subscribe(sink);
	}
}
