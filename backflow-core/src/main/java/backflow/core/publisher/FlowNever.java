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

import org.reactivestreams.Subscriber;

/**
 * Never signals anything beyond {@code onSubscribe}.
 */
final class FlowNever extends Flow<Object> {

	private static final Flow<Object> INSTANCE = new FlowNever();

	private FlowNever() {
	}

	@Override
	protected void subscribeActual(Subscriber<? super Object> actual) {
		actual.onSubscribe(Operators.emptySubscription());
	}

	@SuppressWarnings("unchecked")
	static <T> Flow<T> instance() {
		return (Flow<T>) INSTANCE;
	}
}
