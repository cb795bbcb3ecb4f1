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

/**
 * Tracks the retries of a single operation. Not thread safe; owned by whichever flow is retrying.
 */
public class Backoff
{
    private final RetryOptions options;
    private long nextMicros;
    private int attempts;

    Backoff(RetryOptions options)
    {
        this.options = options;
        reset();
    }

    /**
     * @return the delay before the next attempt, and count the attempt
     */
    public long nextDelayMicros()
    {
        long delay = nextMicros;
        long max = options.maxBackoff.toNanos() / 1000;
        nextMicros = Math.min(max, (long) (nextMicros * options.multiplier));
        ++attempts;
        return delay;
    }

    public void reset()
    {
        nextMicros = options.initialBackoff.toNanos() / 1000;
    }

    public int attempts()
    {
        return attempts;
    }

    public boolean isExhausted()
    {
        return !options.isUnbounded() && attempts >= options.maxAttempts;
    }
}
