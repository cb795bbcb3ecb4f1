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
import rangekv.primitives.Timestamp;

/**
 * Adds {@code delta} to the 8-byte big-endian integer stored at the key; a missing key counts as zero.
 */
public class Increment extends Request<Increment.IncrementReply>
{
    public static class IncrementReply extends Reply
    {
        public final long newValue;

        public IncrementReply(Timestamp timestamp, long newValue)
        {
            super(timestamp);
            this.newValue = newValue;
        }
    }

    public final long delta;

    public Increment(Key key, long delta)
    {
        this(RequestHeader.of(key), delta);
    }

    private Increment(RequestHeader header, long delta)
    {
        super(header);
        this.delta = delta;
    }

    @Override
    public Method method()
    {
        return Method.INCREMENT;
    }

    @Override
    public Increment withHeader(RequestHeader header)
    {
        return new Increment(header, delta);
    }
}
