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

import java.util.Arrays;

import javax.annotation.Nullable;

import static rangekv.utils.Invariants.nonNull;

/**
 * One write of an atomic batch
 */
public final class Mutation
{
    public enum Kind { PUT, DELETE }

    public final Kind kind;
    public final Key key;
    private final @Nullable byte[] value;

    private Mutation(Kind kind, Key key, @Nullable byte[] value)
    {
        this.kind = kind;
        this.key = key;
        this.value = value;
    }

    public static Mutation put(Key key, byte[] value)
    {
        return new Mutation(Kind.PUT, key, nonNull(value, "value").clone());
    }

    public static Mutation delete(Key key)
    {
        return new Mutation(Kind.DELETE, key, null);
    }

    /**
     * @return the value written, or null for a delete
     */
    public @Nullable byte[] value()
    {
        return value == null ? null : value.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Mutation)) return false;
        Mutation that = (Mutation) o;
        return kind == that.kind && key.equals(that.key) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode()
    {
        return (kind.hashCode() * 31 + key.hashCode()) * 31 + Arrays.hashCode(value);
    }

    @Override
    public String toString()
    {
        return kind == Kind.PUT ? "put " + key : "delete " + key;
    }
}
