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

import java.io.IOException;
import java.util.logging.Level;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import backflow.util.Logger;
import backflow.util.Loggers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class FlowLogTest {

	Logger logger;

	@BeforeEach
	public void useMockLogger() {
		logger = mock(Logger.class);
		when(logger.getName()).thenReturn("devices");
		when(logger.isInfoEnabled()).thenReturn(true);
		when(logger.isErrorEnabled()).thenReturn(true);
		Loggers.useCustomLoggers(name -> logger);
	}

	@AfterEach
	public void resetLoggerFactory() {
		Loggers.resetLoggerFactory();
	}

	@Test
	public void logsSignalsAtInfo() {
		StepVerifier.create(Flow.just(1, 2).log("devices", Level.INFO))
		            .expectNext(1, 2)
		            .verifyComplete();

		verify(logger).info(eq(FlowLog.LOG_TEMPLATE), eq(""), eq("onSubscribe"), any());
		verify(logger).info(FlowLog.LOG_TEMPLATE, "", "request", "unbounded");
		verify(logger).info(FlowLog.LOG_TEMPLATE, "", "onNext", 1);
		verify(logger).info(FlowLog.LOG_TEMPLATE, "", "onNext", 2);
		verify(logger).info(FlowLog.LOG_TEMPLATE, "", "onComplete", "");
	}

	@Test
	public void disabledLevelLogsNothing() {
		StepVerifier.create(Flow.just(1).log("devices", Level.FINE))
		            .expectNext(1)
		            .verifyComplete();

		verify(logger, never()).debug(anyString(), any(Object[].class));
		verify(logger, never()).info(anyString(), any(Object[].class));
	}

	@Test
	public void failuresAreLoggedAtError() {
		IOException failure = new IOException("lost");

		StepVerifier.create(Flow.error(failure).log("devices", Level.FINE))
		            .verifyErrorMessage("lost");

		verify(logger).error(FlowLog.LOG_TEMPLATE, "", "onError", failure);
	}

	@Test
	public void laterSubscriptionsArePrefixed() {
		Flow<Integer> logged = Flow.just(1).log("devices", Level.INFO);

		StepVerifier.create(logged).expectNext(1).verifyComplete();
		StepVerifier.create(logged).expectNext(1).verifyComplete();

		verify(logger).info(FlowLog.LOG_TEMPLATE, "[2].", "onNext", 1);
	}

	@Test
	public void cancelIsLogged() {
		StepVerifier.create(Flow.never().log("devices", Level.INFO))
		            .thenCancel()
		            .verify();

		verify(logger).info(FlowLog.LOG_TEMPLATE, "", "cancel", "");
	}

	@Test
	public void toStringNamesCategory() {
		assertThat(Flow.just(1).log("devices", Level.INFO)).hasToString("/loggers/devices");
	}
}
