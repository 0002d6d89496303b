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
import java.util.function.Consumer;

import backflow.util.Logger;
import backflow.util.Loggers;
import backflow.util.annotation.Nullable;

/**
 * Global callbacks for signals an operator has to drop: a value that arrives after
 * cancellation, or a failure that has nowhere left to go.
 * <p>
 * Without a callback, dropped failures are logged at ERROR level and dropped values at
 * DEBUG level. Registering several callbacks chains them in registration order.
 */
public abstract class Hooks {

	public static void onErrorDropped(Consumer<? super Throwable> c) {
		Objects.requireNonNull(c, "onErrorDropped");
		log.debug("Adding an onErrorDropped callback");
		synchronized (LOCK) {
			Consumer<? super Throwable> previous = onErrorDroppedHook;
			onErrorDroppedHook = previous == null ? c : chain(previous, c);
		}
	}

	public static void onNextDropped(Consumer<Object> c) {
		Objects.requireNonNull(c, "onNextDropped");
		log.debug("Adding an onNextDropped callback");
		synchronized (LOCK) {
			Consumer<Object> previous = onNextDroppedHook;
			onNextDroppedHook = previous == null ? c : chain(previous, c);
		}
	}

	/**
	 * Remove every onErrorDropped callback, going back to logging.
	 */
	public static void resetOnErrorDropped() {
		log.debug("Removing the onErrorDropped callbacks");
		synchronized (LOCK) {
			onErrorDroppedHook = null;
		}
	}

	/**
	 * Remove every onNextDropped callback, going back to logging.
	 */
	public static void resetOnNextDropped() {
		log.debug("Removing the onNextDropped callbacks");
		synchronized (LOCK) {
			onNextDroppedHook = null;
		}
	}

	static <T> Consumer<T> chain(Consumer<? super T> first, Consumer<? super T> second) {
		return t -> {
			first.accept(t);
			second.accept(t);
		};
	}

	@Nullable
	static volatile Consumer<? super Throwable> onErrorDroppedHook;
	@Nullable
	static volatile Consumer<Object>            onNextDroppedHook;

	static final Object LOCK = new Object();

	static final Logger log = Loggers.getLogger(Hooks.class);

	Hooks() {
	}
}
