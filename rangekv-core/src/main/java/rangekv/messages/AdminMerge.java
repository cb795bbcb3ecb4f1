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
 * Merges the range containing {@code key} with the range immediately after it
 */
public class AdminMerge extends Request<AdminMerge.AdminMergeReply>
{
    public static class AdminMergeReply extends Reply
    {
        public final RangeDescriptor merged;

        public AdminMergeReply(Timestamp timestamp, RangeDescriptor merged)
        {
            super(timestamp);
            this.merged = merged;
        }
    }

    public AdminMerge(Key key)
    {
        this(RequestHeader.of(key));
    }

    private AdminMerge(RequestHeader header)
    {
        super(header);
    }

    @Override
    public Method method()
    {
        return Method.ADMIN_MERGE;
    }

    @Override
    public AdminMerge withHeader(RequestHeader header)
    {
        return new AdminMerge(header);
    }
}
