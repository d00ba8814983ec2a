/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cadence.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.getMaxAttempts());
        assertEquals(BackoffStrategy.EXPONENTIAL, policy.getBackoffStrategy());
        assertEquals(Duration.ofSeconds(1), policy.getBaseDelay());
        assertEquals(Duration.ofSeconds(300), policy.getMaxDelay());
        assertTrue(policy.isJitter());
    }

    @Test
    void noRetryAllowsASingleAttempt() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertEquals(1, policy.getMaxAttempts());
        assertFalse(policy.isJitter());
    }

    @Test
    void rejectsZeroAttempts() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().maxAttempts(0).build());
        assertTrue(e.getMessage().contains("maxAttempts"));
    }

    @Test
    void rejectsNegativeBaseDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().baseDelay(Duration.ofMillis(-1)).build());
    }

    @Test
    void rejectsMaxDelayBelowBaseDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().baseDelay(Duration.ofSeconds(10)).maxDelay(Duration.ofSeconds(5)).build());
    }

    @Test
    void toBuilderCopiesEveryField() {
        RetryPolicy original = RetryPolicy.builder()
                .maxAttempts(5)
                .backoffStrategy(BackoffStrategy.LINEAR)
                .baseDelay(Duration.ofMillis(250))
                .maxDelay(Duration.ofSeconds(2))
                .jitter(false)
                .build();

        assertEquals(original, original.toBuilder().build());
        assertNotEquals(original, original.toBuilder().maxAttempts(6).build());
    }

    @ParameterizedTest
    @ValueSource(strings = {"fixed", "LINEAR", " Exponential "})
    void backoffStrategyParsesWireNames(String value) {
        assertNotNull(BackoffStrategy.fromValue(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"random", "", "exp"})
    void backoffStrategyRejectsUnknownNames(String value) {
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.fromValue(value));
    }

    @Test
    void failureStrategyParsesWireNames() {
        assertEquals(FailureStrategy.CONTINUE_ON_ERROR, FailureStrategy.fromValue("continue_on_error"));
        assertEquals(FailureStrategy.STOP_ON_ERROR, FailureStrategy.fromValue("STOP_ON_ERROR"));
        assertEquals(FailureStrategy.RETRY_FAILED, FailureStrategy.fromValue("retry_failed"));
        assertThrows(IllegalArgumentException.class, () -> FailureStrategy.fromValue("ignore"));
        assertThrows(IllegalArgumentException.class, () -> FailureStrategy.fromValue(null));
    }

    @Test
    void onlyStopOnErrorHaltsTheWorkflow() {
        assertTrue(FailureStrategy.STOP_ON_ERROR.haltsWorkflow());
        assertFalse(FailureStrategy.CONTINUE_ON_ERROR.haltsWorkflow());
        assertFalse(FailureStrategy.RETRY_FAILED.haltsWorkflow());
    }
}
