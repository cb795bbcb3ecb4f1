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

import static rangekv.utils.Invariants.checkArgument;

/**
 * Deletes every key in {@code [key, endKey)}
 */
public class DeleteRange extends Request<DeleteRange.DeleteRangeReply>
{
    public static class DeleteRangeReply extends Reply
    {
        public final int deleted;

        public DeleteRangeReply(Timestamp timestamp, int deleted)
        {
            super(timestamp);
            this.deleted = deleted;
        }
    }

    public DeleteRange(Key start, Key end)
    {
        this(RequestHeader.of(start, end));
        checkArgument(start.compareTo(end) < 0, "empty span %s-%s", start, end);
    }

    private DeleteRange(RequestHeader header)
    {
        super(header);
    }

    public Key endKey()
    {
        return header.endKey;
    }

    @Override
    public Method method()
    {
        return Method.DELETE_RANGE;
    }

    @Override
    public DeleteRange withHeader(RequestHeader header)
    {
        return new DeleteRange(header);
    }
}
