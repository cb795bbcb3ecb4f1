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
import java.util.Objects;

import static rangekv.utils.Invariants.checkArgument;

/**
 * Exponential backoff policy: the first retry waits {@code initialBackoff}, each subsequent one
 * {@code multiplier} times longer, never more than {@code maxBackoff}. {@code maxAttempts == 0} retries forever.
 */
public final class RetryOptions
{
    public static final RetryOptions DEFAULT = new RetryOptions(Duration.ofMillis(150), Duration.ofSeconds(5), 2, 0);

    public final Duration initialBackoff;
    public final Duration maxBackoff;
    public final double multiplier;
    public final int maxAttempts;

    public RetryOptions(Duration initialBackoff, Duration maxBackoff, double multiplier, int maxAttempts)
    {
        checkArgument(!initialBackoff.isNegative(), "initialBackoff must not be negative: %s", initialBackoff);
        checkArgument(maxBackoff.compareTo(initialBackoff) >= 0, "maxBackoff %s is less than initialBackoff %s", maxBackoff, initialBackoff);
        checkArgument(multiplier >= 1, "multiplier must be at least 1");
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.multiplier = multiplier;
        this.maxAttempts = Invariants.isNatural(maxAttempts);
    }

    public RetryOptions withMaxAttempts(int maxAttempts)
    {
        return new RetryOptions(initialBackoff, maxBackoff, multiplier, maxAttempts);
    }

    public boolean isUnbounded()
    {
        return maxAttempts == 0;
    }

    public Backoff newBackoff()
    {
        return new Backoff(this);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof RetryOptions)) return false;
        RetryOptions that = (RetryOptions) o;
        return Double.compare(that.multiplier, multiplier) == 0
               && maxAttempts == that.maxAttempts
               && initialBackoff.equals(that.initialBackoff)
               && maxBackoff.equals(that.maxBackoff);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(initialBackoff, maxBackoff, multiplier, maxAttempts);
    }

    @Override
    public String toString()
    {
        return "RetryOptions{initial=" + initialBackoff + ", max=" + maxBackoff + ", multiplier=" + multiplier + ", maxAttempts=" + maxAttempts + '}';
    }
}
