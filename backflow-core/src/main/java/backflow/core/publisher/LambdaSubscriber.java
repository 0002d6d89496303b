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
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.Consumer;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import backflow.core.Disposable;
import backflow.core.Exceptions;
import backflow.util.annotation.Nullable;

/**
 * An unbounded {@link Subscriber} calling back lambdas, as returned by the
 * {@code Flow.subscribe(...)} variants. A value consumer that throws cancels the
 * subscription and the failure goes to the error consumer. Without an error consumer,
 * failures are reported to {@link Operators#onErrorDropped(Throwable)} wrapped in
 * {@link Exceptions#errorCallbackNotImplemented(Throwable)}.
 *
 * @param <T> the value type
 */
final class LambdaSubscriber<T> implements Subscriber<T>, Disposable {

	@Nullable
	final Consumer<? super T>         consumer;
	@Nullable
	final Consumer<? super Throwable> errorConsumer;
	@Nullable
	final Runnable                    completeConsumer;

	volatile Subscription subscription;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<LambdaSubscriber, Subscription> S =
			AtomicReferenceFieldUpdater.newUpdater(LambdaSubscriber.class,
					Subscription.class,
					"subscription");

	LambdaSubscriber(@Nullable Consumer<? super T> consumer,
			@Nullable Consumer<? super Throwable> errorConsumer,
			@Nullable Runnable completeConsumer) {
		this.consumer = consumer;
		this.errorConsumer = errorConsumer;
		this.completeConsumer = completeConsumer;
	}

	@Override
	public final void onSubscribe(Subscription s) {
		if (Operators.setOnce(S, this, s)) {
			try {
				s.request(Long.MAX_VALUE);
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				s.cancel();
				onError(t);
			}
		}
	}

	@Override
	public final void onComplete() {
		Subscription s = S.getAndSet(this, Operators.cancelledSubscription());
		if (s == Operators.cancelledSubscription()) {
			return;
		}
		if (completeConsumer != null) {
			try {
				completeConsumer.run();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				Operators.onErrorDropped(t);
			}
		}
	}

	@Override
	public final void onError(Throwable t) {
		Objects.requireNonNull(t, "onError");
		Subscription s = S.getAndSet(this, Operators.cancelledSubscription());
		if (s == Operators.cancelledSubscription()) {
			Operators.onErrorDropped(t);
			return;
		}
		if (errorConsumer != null) {
			try {
				errorConsumer.accept(t);
			}
			catch (Throwable e) {
				Exceptions.throwIfFatal(e);
				e.addSuppressed(t);
				Operators.onErrorDropped(e);
			}
		}
		else {
			Operators.onErrorDropped(Exceptions.errorCallbackNotImplemented(t));
		}
	}

	@Override
	public final void onNext(T x) {
		Objects.requireNonNull(x, "onNext");
		try {
			if (consumer != null) {
				consumer.accept(x);
			}
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			Subscription s = subscription;
			if (s != null) {
				s.cancel();
			}
			onError(t);
		}
	}

	@Override
	public boolean isDisposed() {
		return subscription == Operators.cancelledSubscription();
	}

	@Override
	public void dispose() {
		Subscription s = S.getAndSet(this, Operators.cancelledSubscription());
		if (s != null && s != Operators.cancelledSubscription()) {
			s.cancel();
		}
	}
}
