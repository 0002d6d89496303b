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

import backflow.util.annotation.Nullable;

/**
 * A signal turned into data by {@link Flow#materialize()}: a value, a failure or the
 * successful completion of a sequence.
 * <p>
 * Events compare by kind and content, and print as {@code value(x)},
 * {@code failure(e)} or {@code finished}.
 *
 * @param <T> the value type
 */
public final class Event<T> {

	static final Event<Object> FINISHED = new Event<>(EventType.FINISHED, null, null);

	/**
	 * @param value the value, not null
	 * @param <T> the value type
	 * @return a {@link EventType#VALUE} event
	 */
	public static <T> Event<T> value(T value) {
		return new Event<>(EventType.VALUE, Objects.requireNonNull(value, "value"), null);
	}

	/**
	 * @param failure the failure, not null
	 * @param <T> the value type
	 * @return a {@link EventType#FAILURE} event
	 */
	public static <T> Event<T> failure(Throwable failure) {
		return new Event<>(EventType.FAILURE, null, Objects.requireNonNull(failure, "failure"));
	}

	/**
	 * @param <T> the value type
	 * @return the {@link EventType#FINISHED} event
	 */
	@SuppressWarnings("unchecked")
	public static <T> Event<T> finished() {
		return (Event<T>) FINISHED;
	}

	final EventType type;
	@Nullable
	final T         value;
	@Nullable
	final Throwable failure;

	Event(EventType type, @Nullable T value, @Nullable Throwable failure) {
		this.type = type;
		this.value = value;
		this.failure = failure;
	}

	public EventType getType() {
		return type;
	}

	/**
	 * @return the value of a {@link EventType#VALUE} event, null otherwise
	 */
	@Nullable
	public T getValue() {
		return value;
	}

	/**
	 * @return the failure of a {@link EventType#FAILURE} event, null otherwise
	 */
	@Nullable
	public Throwable getFailure() {
		return failure;
	}

	public boolean isValue() {
		return type == EventType.VALUE;
	}

	public boolean isFailure() {
		return type == EventType.FAILURE;
	}

	public boolean isFinished() {
		return type == EventType.FINISHED;
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Event)) {
			return false;
		}
		Event<?> other = (Event<?>) o;
		return type == other.type
				&& Objects.equals(value, other.value)
				&& Objects.equals(failure, other.failure);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, failure);
	}

	@Override
	public String toString() {
		switch (type) {
			case VALUE:
				return "value(" + value + ")";
			case FAILURE:
				return "failure(" + failure + ")";
			default:
				return "finished";
		}
	}
}
