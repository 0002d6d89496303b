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
 * Exposes an arbitrary {@link Publisher} as a {@link Flow}.
 *
 * @param <T> the value type
 */
final class FlowSource<T> extends Flow<T> {

	final Publisher<? extends T> source;

	FlowSource(Publisher<? extends T> source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		source.subscribe(actual);
	}

	@Override
	public String toString() {
		return "FlowSource(" + source + ")";
	}
}
