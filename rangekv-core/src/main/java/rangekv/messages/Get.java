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
import rangekv.primitives.Timestamp;

public class Get extends Request<Get.GetReply>
{
    public static class GetReply extends Reply
    {
        private final @Nullable byte[] value;

        public GetReply(Timestamp timestamp, @Nullable byte[] value)
        {
            super(timestamp);
            this.value = value;
        }

        /**
         * @return the value, or null if the key has none
         */
        public @Nullable byte[] value()
        {
            return value == null ? null : value.clone();
        }
    }

    public Get(Key key)
    {
        this(RequestHeader.of(key));
    }

    private Get(RequestHeader header)
    {
        super(header);
    }

    @Override
    public Method method()
    {
        return Method.GET;
    }

    @Override
    public Get withHeader(RequestHeader header)
    {
        return new Get(header);
    }
}
