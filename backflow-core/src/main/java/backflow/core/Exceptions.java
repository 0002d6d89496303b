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

package backflow.core;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

import backflow.util.annotation.Nullable;

/**
 * Factories for the exceptions backflow operators signal, plus the checks that keep
 * fatal errors out of {@code onError}.
 * <p>
 * Callbacks such as {@code map} cannot throw checked exceptions. Wrap them with
 * {@link #propagate(Throwable)}; the operator catching the wrapper hands the original
 * exception to the subscriber.
 */
public abstract class Exceptions {

	/**
	 * Message of the failure a bounded buffer signals when its source ignores demand.
	 */
	public static final String OVERFLOW_MESSAGE = "Buffer overflow: the source emitted more values than were requested";

	/**
	 * Turn any {@link Throwable} into something a callback can throw. Unchecked
	 * exceptions are returned as they are, checked ones are wrapped so that
	 * {@link #unwrap(Throwable)} can recover them. Fatal errors are rethrown.
	 *
	 * @param t the failure to carry
	 * @return an unchecked exception to throw from the callback
	 */
	public static RuntimeException propagate(Throwable t) {
		throwIfFatal(t);
		if (t instanceof RuntimeException) {
			return (RuntimeException) t;
		}
		return new CheckedFailure(t);
	}

	/**
	 * Strip the wrapper added by {@link #propagate(Throwable)}.
	 *
	 * @param t a failure caught from a callback
	 * @return the wrapped checked exception, or {@code t} when it was not wrapped
	 */
	public static Throwable unwrap(Throwable t) {
		if (t instanceof CheckedFailure && t.getCause() != null) {
			return t.getCause();
		}
		return t;
	}

	/**
	 * @return the failure a one-time subscription reports on a second {@code onSubscribe}
	 */
	public static IllegalStateException duplicateOnSubscribeException() {
		return new IllegalStateException("onSubscribe was called more than once");
	}

	/**
	 * Wrap a failure that reached a subscriber with no failure callback. The result is
	 * fatal: {@link #throwIfFatal(Throwable)} rethrows it.
	 *
	 * @param cause the unhandled failure
	 * @return an {@link UnsupportedOperationException} caused by {@code cause}
	 */
	public static UnsupportedOperationException errorCallbackNotImplemented(Throwable cause) {
		Objects.requireNonNull(cause, "cause");
		return new MissingErrorCallback(cause);
	}

	/**
	 * @return the failure of a bounded buffer whose source ignored demand
	 * @see #isOverflow(Throwable)
	 */
	public static IllegalStateException failWithOverflow() {
		return new Overflow();
	}

	/**
	 * A task could not be scheduled. An executor's own rejection is kept as is.
	 *
	 * @param cause what the executor threw, may be null
	 * @return a {@link RejectedExecutionException}
	 */
	public static RejectedExecutionException failWithRejected(@Nullable Throwable cause) {
		if (cause instanceof RejectedExecutionException) {
			return (RejectedExecutionException) cause;
		}
		return new RejectedExecutionException("Scheduler unavailable", cause);
	}

	/**
	 * @param what the kind of signal that came too late
	 * @return the failure of a buffer that is fed after it terminated
	 */
	public static IllegalStateException failWithTerminated(String what) {
		return new IllegalStateException("Cannot buffer " + what + " after a terminal event");
	}

	/**
	 * @param elements the rejected request amount
	 * @return the failure a subscription reports for a request that is not positive
	 */
	public static IllegalArgumentException nullOrNegativeRequestException(long elements) {
		return new IllegalArgumentException("Requested amount must be positive, got " + elements);
	}

	public static boolean isOverflow(@Nullable Throwable t) {
		return t instanceof Overflow;
	}

	public static boolean isErrorCallbackNotImplemented(@Nullable Throwable t) {
		return t instanceof MissingErrorCallback;
	}

	/**
	 * Rethrow {@code t} if no subscriber should ever see it: a missing failure callback,
	 * a {@link VirtualMachineError} or a {@link LinkageError}.
	 *
	 * @param t the failure to check, may be null
	 */
	public static void throwIfFatal(@Nullable Throwable t) {
		if (t instanceof MissingErrorCallback) {
			throw (MissingErrorCallback) t;
		}
		if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	Exceptions() {
	}

	static final class CheckedFailure extends RuntimeException {

		CheckedFailure(Throwable cause) {
			super(cause);
		}

		private static final long serialVersionUID = 2083316478829560401L;
	}

	static final class MissingErrorCallback extends UnsupportedOperationException {

		MissingErrorCallback(Throwable cause) {
			super("No failure callback was given to subscribe", cause);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}

		private static final long serialVersionUID = 7713525068209391164L;
	}

	static final class Overflow extends IllegalStateException {

		Overflow() {
			super(OVERFLOW_MESSAGE);
		}

		private static final long serialVersionUID = -5271307750162411922L;
	}
}
