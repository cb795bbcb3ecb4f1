/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package rangekv.utils;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffTest
{
    @Test
    void growsToCap()
    {
        Backoff backoff = new RetryOptions(Duration.ofMillis(100), Duration.ofMillis(500), 2, 0).newBackoff();
        assertThat(backoff.nextDelayMicros()).isEqualTo(100_000);
        assertThat(backoff.nextDelayMicros()).isEqualTo(200_000);
        assertThat(backoff.nextDelayMicros()).isEqualTo(400_000);
        assertThat(backoff.nextDelayMicros()).isEqualTo(500_000);
        assertThat(backoff.nextDelayMicros()).isEqualTo(500_000);
        assertThat(backoff.attempts()).isEqualTo(5);
        assertThat(backoff.isExhausted()).isFalse();

        backoff.reset();
        assertThat(backoff.nextDelayMicros()).isEqualTo(100_000);
    }

    @Test
    void boundedAttempts()
    {
        Backoff backoff = RetryOptions.DEFAULT.withMaxAttempts(2).newBackoff();
        assertThat(backoff.isExhausted()).isFalse();
        backoff.nextDelayMicros();
        assertThat(backoff.isExhausted()).isFalse();
        backoff.nextDelayMicros();
        assertThat(backoff.isExhausted()).isTrue();
    }

    @Test
    void defaults()
    {
        assertThat(RetryOptions.DEFAULT.initialBackoff).isEqualTo(Duration.ofMillis(150));
        assertThat(RetryOptions.DEFAULT.maxBackoff).isEqualTo(Duration.ofSeconds(5));
        assertThat(RetryOptions.DEFAULT.isUnbounded()).isTrue();
    }

    @Test
    void rejectsInvalidOptions()
    {
        assertThatThrownBy(() -> new RetryOptions(Duration.ofMillis(-1), Duration.ofMillis(10), 2, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("initialBackoff must not be negative: ");
        assertThatThrownBy(() -> new RetryOptions(Duration.ofMillis(10), Duration.ofMillis(1), 2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryOptions(Duration.ofMillis(1), Duration.ofMillis(10), 0.5, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryOptions.DEFAULT.withMaxAttempts(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
