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

import java.util.List;

import com.google.common.collect.ImmutableList;

import rangekv.primitives.Key;
import rangekv.primitives.KeyValue;
import rangekv.primitives.Timestamp;

import static rangekv.utils.Invariants.checkArgument;

/**
 * Reads the values of {@code [key, endKey)} in key order, stopping after {@code maxResults} rows
 * ({@code 0} for no limit).
 */
public class Scan extends Request<Scan.ScanReply>
{
    public static class ScanReply extends Reply
    {
        public final ImmutableList<KeyValue> rows;

        public ScanReply(Timestamp timestamp, List<KeyValue> rows)
        {
            super(timestamp);
            this.rows = ImmutableList.copyOf(rows);
        }
    }

    public final int maxResults;

    public Scan(Key start, Key end, int maxResults)
    {
        this(RequestHeader.of(start, end), maxResults);
        checkArgument(start.compareTo(end) < 0, "empty span %s-%s", start, end);
        checkArgument(maxResults >= 0, "negative maxResults");
    }

    private Scan(RequestHeader header, int maxResults)
    {
        super(header);
        this.maxResults = maxResults;
    }

    public Key endKey()
    {
        return header.endKey;
    }

    @Override
    public Method method()
    {
        return Method.SCAN;
    }

    @Override
    public Scan withHeader(RequestHeader header)
    {
        return new Scan(header, maxResults);
    }
}
