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

import rangekv.primitives.Key;

import static rangekv.utils.Invariants.nonNull;

public class Put extends Request<Reply>
{
    private final byte[] value;

    public Put(Key key, byte[] value)
    {
        this(RequestHeader.of(key), nonNull(value, "value").clone());
    }

    private Put(RequestHeader header, byte[] value)
    {
        super(header);
        this.value = value;
    }

    public byte[] value()
    {
        return value.clone();
    }

    @Override
    public Method method()
    {
        return Method.PUT;
    }

    @Override
    public Put withHeader(RequestHeader header)
    {
        return new Put(header, value);
    }
}
