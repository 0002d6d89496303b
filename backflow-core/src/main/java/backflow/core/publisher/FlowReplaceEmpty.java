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
 * Switches to an alternative publisher if the source completes without any value.
 * Demand the source did not consume carries over to the alternative.
 *
 * @param <T> the value type
 */
final class FlowReplaceEmpty<T> extends Flow<T> {

	final Publisher<? extends T> source;

	final Publisher<? extends T> alternative;

	FlowReplaceEmpty(Publisher<? extends T> source, Publisher<? extends T> alternative) {
		this.source = Objects.requireNonNull(source, "source");
		this.alternative = Objects.requireNonNull(alternative, "alternative");
	}

	@Override
	protected void subscribeActual(Subscriber<? super T> actual) {
		ReplaceEmptySubscriber<T> parent = new ReplaceEmptySubscriber<>(actual, alternative);

		actual.onSubscribe(parent);

		source.subscribe(parent);
	}

	static final class ReplaceEmptySubscriber<T> extends SubscriptionArbiter<T> {

		final Publisher<? extends T> alternative;

		boolean once;

		ReplaceEmptySubscriber(Subscriber<? super T> actual, Publisher<? extends T> alternative) {
			super(actual);
			this.alternative = alternative;
		}

		@Override
		public void onNext(T t) {
			if (!once) {
				once = true;
			}

			actual.onNext(t);
		}

		@Override
		public void onComplete() {
			if (!once) {
				once = true;

				if (!isCancelled()) {
					alternative.subscribe(this);
				}
			}
			else {
				actual.onComplete();
			}
		}
	}
}
