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

package rangekv.primitives;

import javax.annotation.Nonnull;

import static rangekv.utils.Invariants.checkArgument;

/**
 * A hybrid logical clock value: physical wall time in milliseconds, plus a logical counter that orders
 * events sharing the same wall time.
 */
public final class Timestamp implements Comparable<Timestamp>
{
    public static final Timestamp NONE = new Timestamp(0, 0);
    public static final Timestamp MAX = new Timestamp(Long.MAX_VALUE, Integer.MAX_VALUE);

    public final long wallTime;
    public final int logical;

    private Timestamp(long wallTime, int logical)
    {
        this.wallTime = wallTime;
        this.logical = logical;
    }

    public static Timestamp of(long wallTime, int logical)
    {
        checkArgument(wallTime >= 0 && logical >= 0, "invalid timestamp %s,%s", wallTime, logical);
        return new Timestamp(wallTime, logical);
    }

    public boolean isNone()
    {
        return wallTime == 0 && logical == 0;
    }

    /**
     * @return the smallest timestamp strictly greater than this one
     */
    public Timestamp next()
    {
        if (logical == Integer.MAX_VALUE)
            return new Timestamp(wallTime + 1, 0);
        return new Timestamp(wallTime, logical + 1);
    }

    public Timestamp addWallTime(long millis)
    {
        return new Timestamp(wallTime + millis, logical);
    }

    public boolean isBefore(Timestamp that)
    {
        return compareTo(that) < 0;
    }

    public boolean isAfter(Timestamp that)
    {
        return compareTo(that) > 0;
    }

    @Override
    public int compareTo(@Nonnull Timestamp that)
    {
        if (this == that) return 0;
        int c = Long.compare(this.wallTime, that.wallTime);
        if (c == 0) c = Integer.compare(this.logical, that.logical);
        return c;
    }

    @Override
    public int hashCode()
    {
        return (int) (wallTime * 31) + logical;
    }

    public boolean equals(Timestamp that)
    {
        return this.wallTime == that.wallTime && this.logical == that.logical;
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof Timestamp && equals((Timestamp) that);
    }

    public static Timestamp max(Timestamp a, Timestamp b)
    {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Timestamp nonNullOrMax(Timestamp a, Timestamp b)
    {
        return a == null ? b : b == null ? a : max(a, b);
    }

    public static Timestamp min(Timestamp a, Timestamp b)
    {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public String toString()
    {
        return "[" + wallTime + ',' + logical + ']';
    }
}
