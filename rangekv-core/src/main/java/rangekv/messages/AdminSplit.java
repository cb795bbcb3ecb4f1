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
import rangekv.primitives.RangeDescriptor;
import rangekv.primitives.Timestamp;

/**
 * Splits the range containing {@code key} so that {@code key} becomes the start of a new range
 */
public class AdminSplit extends Request<AdminSplit.AdminSplitReply>
{
    public static class AdminSplitReply extends Reply
    {
        public final RangeDescriptor left;
        public final RangeDescriptor right;

        public AdminSplitReply(Timestamp timestamp, RangeDescriptor left, RangeDescriptor right)
        {
            super(timestamp);
            this.left = left;
            this.right = right;
        }
    }

    public AdminSplit(Key splitKey)
    {
        this(RequestHeader.of(splitKey));
    }

    private AdminSplit(RequestHeader header)
    {
        super(header);
    }

    @Override
    public Method method()
    {
        return Method.ADMIN_SPLIT;
    }

    @Override
    public AdminSplit withHeader(RequestHeader header)
    {
        return new AdminSplit(header);
    }
}
