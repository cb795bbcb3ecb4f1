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

package rangekv.local;

import java.util.function.LongSupplier;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangekv.api.Clock;
import rangekv.primitives.Timestamp;

/**
 * Physical milliseconds from a supplied source, with a logical counter to order events within one millisecond
 * and to follow timestamps observed from other nodes.
 */
public class HybridLogicalClock implements Clock
{
    private static final Logger logger = LoggerFactory.getLogger(HybridLogicalClock.class);

    private final LongSupplier physicalMillis;
    private final long maxOffsetMillis;

    private long wallTime;
    private int logical;

    public HybridLogicalClock(long maxOffsetMillis)
    {
        this(System::currentTimeMillis, maxOffsetMillis);
    }

    @VisibleForTesting
    public HybridLogicalClock(LongSupplier physicalMillis, long maxOffsetMillis)
    {
        this.physicalMillis = physicalMillis;
        this.maxOffsetMillis = maxOffsetMillis;
    }

    @Override
    public synchronized Timestamp now()
    {
        long physical = physicalMillis.getAsLong();
        if (physical > wallTime)
        {
            wallTime = physical;
            logical = 0;
        }
        else
        {
            ++logical;
        }
        return Timestamp.of(wallTime, logical);
    }

    @Override
    public synchronized Timestamp update(Timestamp observed)
    {
        long physical = physicalMillis.getAsLong();
        if (physical > wallTime && physical > observed.wallTime)
        {
            wallTime = physical;
            logical = 0;
        }
        else if (observed.wallTime > wallTime)
        {
            if (maxOffsetMillis > 0 && observed.wallTime - physical > maxOffsetMillis)
                logger.warn("Observed timestamp {} is {}ms ahead of the local clock, more than the max offset of {}ms",
                            observed, observed.wallTime - physical, maxOffsetMillis);
            wallTime = observed.wallTime;
            logical = observed.logical + 1;
        }
        else if (observed.wallTime == wallTime)
        {
            logical = Math.max(logical, observed.logical) + 1;
        }
        else
        {
            ++logical;
        }
        return Timestamp.of(wallTime, logical);
    }

    @Override
    public long maxOffsetMillis()
    {
        return maxOffsetMillis;
    }
}
