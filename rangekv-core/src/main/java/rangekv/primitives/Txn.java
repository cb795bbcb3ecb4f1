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

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import com.google.common.annotations.VisibleForTesting;

import rangekv.api.Clock;

/**
 * The record of one logical transaction. Immutable: every change produces a new record, so a record
 * stamped onto an in-flight request can never be altered underneath it.
 *
 * A restart after an ordering conflict keeps the {@link #id} and increments the {@link #epoch};
 * a restart after the transaction was aborted by a conflicting transaction gets a new {@link #id}.
 */
public final class Txn
{
    private static final int ID_RANDOM_BYTES = 16;

    /**
     * The anchor key followed by random bytes
     */
    public final Key id;

    /**
     * The key of the first operation of the transaction
     */
    public final Key key;
    public final int epoch;
    public final int priority;
    public final IsolationLevel isolation;
    public final Timestamp timestamp;

    public Txn(Key id, Key key, int epoch, int priority, IsolationLevel isolation, Timestamp timestamp)
    {
        this.id = id;
        this.key = key;
        this.epoch = epoch;
        this.priority = priority;
        this.isolation = isolation;
        this.timestamp = timestamp;
    }

    public static Txn create(Key anchor, int userPriority, IsolationLevel isolation, Clock clock)
    {
        Random random = ThreadLocalRandom.current();
        byte[] suffix = new byte[ID_RANDOM_BYTES];
        random.nextBytes(suffix);
        Key id = Key.make(anchor, Key.of(suffix));
        return new Txn(id, anchor, 0, makePriority(userPriority, random), isolation, clock.now());
    }

    /**
     * A negative user priority {@code -p} asks for exactly priority {@code p}. Otherwise a random priority is
     * drawn, biased towards {@link Integer#MAX_VALUE} in proportion to the user priority.
     */
    @VisibleForTesting
    static int makePriority(int userPriority, Random random)
    {
        if (userPriority < 0)
            return userPriority == Integer.MIN_VALUE ? Integer.MAX_VALUE : -userPriority;
        if (userPriority == 0)
            userPriority = 1;
        return Integer.MAX_VALUE - random.nextInt(Integer.MAX_VALUE / userPriority);
    }

    public Txn withTimestamp(Timestamp timestamp)
    {
        return new Txn(id, key, epoch, priority, isolation, timestamp);
    }

    /**
     * Restart with the same identity; the timestamp never moves backwards.
     */
    public Txn nextEpoch(Timestamp atLeast)
    {
        return new Txn(id, key, epoch + 1, priority, isolation, Timestamp.max(timestamp, atLeast));
    }

    /**
     * @return this record with its priority raised to {@code priority}, or this record if it is already as high
     */
    public Txn upgradePriority(int priority)
    {
        if (priority <= this.priority)
            return this;
        return new Txn(id, key, epoch, priority, isolation, timestamp);
    }

    public boolean isSameTxn(Txn that)
    {
        return that != null && id.equals(that.id);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Txn)) return false;
        Txn that = (Txn) o;
        return epoch == that.epoch
               && priority == that.priority
               && id.equals(that.id)
               && key.equals(that.key)
               && isolation == that.isolation
               && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(id, epoch, priority, isolation, timestamp);
    }

    @Override
    public String toString()
    {
        return "Txn{key=" + key + ", epoch=" + epoch + ", priority=" + priority + ", " + isolation + ", ts=" + timestamp + '}';
    }
}
