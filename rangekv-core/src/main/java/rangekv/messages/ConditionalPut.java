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

package rangekv.messages;

import javax.annotation.Nullable;

import rangekv.primitives.Key;

import static rangekv.utils.Invariants.nonNull;

/**
 * Writes {@code value} only if the current value equals {@code expected}; a null {@code expected} requires
 * that the key has no value. Otherwise fails with {@link rangekv.coordinate.ConditionFailed}.
 */
public class ConditionalPut extends Request<Reply>
{
    private final byte[] value;
    private final @Nullable byte[] expected;

    public ConditionalPut(Key key, byte[] value, @Nullable byte[] expected)
    {
        this(RequestHeader.of(key), nonNull(value, "value").clone(), expected == null ? null : expected.clone());
    }

    private ConditionalPut(RequestHeader header, byte[] value, @Nullable byte[] expected)
    {
        super(header);
        this.value = value;
        this.expected = expected;
    }

    public byte[] value()
    {
        return value.clone();
    }

    public @Nullable byte[] expected()
    {
        return expected == null ? null : expected.clone();
    }

    @Override
    public Method method()
    {
        return Method.CONDITIONAL_PUT;
    }

    @Override
    public ConditionalPut withHeader(RequestHeader header)
    {
        return new ConditionalPut(header, value, expected);
    }
}
