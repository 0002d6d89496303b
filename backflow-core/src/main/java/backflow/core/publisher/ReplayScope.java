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
 * How long {@link Flow#shareReplay(int, ReplayScope)} keeps its upstream connection and
 * replay history.
 */
public enum ReplayScope {

	/**
	 * Connect once. The history and the terminal signal are kept for every later
	 * subscriber, even after all current subscribers have left; the upstream is never
	 * subscribed again.
	 */
	FOREVER,
	/**
	 * Keep the connection and the history only while at least one subscriber is
	 * attached and the upstream has not terminated. The next subscriber after that
	 * reconnects to a fresh upstream subscription with an empty history.
	 */
	WHILE_CONNECTED
}
