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

import org.reactivestreams.Subscriber;

/**
 * Fails right after subscription.
 *
 * @param <T> the value type
 */
final class FlowError<T> extends Flow<T> {

	final Throwable error;

	FlowError(Throwable error) {
		this.error = Objects.requireNonNull(error, "error");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		Operators.error(actual, error);
	}

	@Override
	public String toString() {
		return "FlowError(" + error + ")";
	}
}
