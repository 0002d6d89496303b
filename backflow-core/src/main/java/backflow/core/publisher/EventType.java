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

/**
 * The kind of a materialized {@link Event}.
 */
public enum EventType {

	/**
	 * A value ({@code onNext}).
	 */
	VALUE,
	/**
	 * A failure ({@code onError}).
	 */
	FAILURE,
	/**
	 * A successful completion ({@code onComplete}).
	 */
	FINISHED;

	/**
	 * @return true for the two terminal kinds
	 */
	public boolean isTerminal() {
		return this != VALUE;
	}
}
