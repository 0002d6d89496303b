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

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import backflow.util.function.Tuples;

public class FlowIndexTest {

	@Test
	public void pairsValuesWithPosition() {
		StepVerifier.create(Flow.just("a", "b", "c").index())
		            .expectNext(Tuples.of(0L, "a"), Tuples.of(1L, "b"), Tuples.of(2L, "c"))
		            .verifyComplete();
	}

	@Test
	public void eachSubscriptionCountsFromZero() {
		Flow<String> indexed = Flow.just("x", "y").index().map(t -> t.getT1() + ":" + t.getT2());

		StepVerifier.create(indexed)
		            .expectNext("0:x", "1:y")
		            .verifyComplete();
		StepVerifier.create(indexed)
		            .expectNext("0:x", "1:y")
		            .verifyComplete();
	}

	@Test
	public void failurePassesThrough() {
		StepVerifier.create(Flow.<String>error(new IllegalStateException("boom")).index())
		            .verifyErrorMessage("boom");
	}
}
