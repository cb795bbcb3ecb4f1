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

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import static rangekv.utils.Invariants.checkArgument;

/**
 * Identity and boundaries of one range, covering {@code [startKey, endKey)}.
 */
public final class RangeDescriptor
{
    public final long rangeId;
    public final Key startKey;
    public final Key endKey;

    public RangeDescriptor(long rangeId, Key startKey, Key endKey)
    {
        checkArgument(startKey.compareTo(endKey) < 0, "start key %s must sort before end key %s", startKey, endKey);
        this.rangeId = rangeId;
        this.startKey = startKey;
        this.endKey = endKey;
    }

    public boolean containsKey(Key key)
    {
        return startKey.compareTo(key) <= 0 && key.compareTo(endKey) < 0;
    }

    public byte[] serialize()
    {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        out.writeLong(rangeId);
        writeKey(out, startKey);
        writeKey(out, endKey);
        return out.toByteArray();
    }

    public static RangeDescriptor deserialize(byte[] bytes)
    {
        ByteArrayDataInput in = ByteStreams.newDataInput(bytes);
        long rangeId = in.readLong();
        Key start = readKey(in);
        Key end = readKey(in);
        return new RangeDescriptor(rangeId, start, end);
    }

    private static void writeKey(ByteArrayDataOutput out, Key key)
    {
        out.writeInt(key.length());
        out.write(key.toByteArray());
    }

    private static Key readKey(ByteArrayDataInput in)
    {
        byte[] bytes = new byte[in.readInt()];
        in.readFully(bytes);
        return Key.of(bytes);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof RangeDescriptor)) return false;
        RangeDescriptor that = (RangeDescriptor) o;
        return rangeId == that.rangeId && startKey.equals(that.startKey) && endKey.equals(that.endKey);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(rangeId, startKey, endKey);
    }

    @Override
    public String toString()
    {
        return "r" + rangeId + ':' + startKey + '-' + endKey;
    }
}
