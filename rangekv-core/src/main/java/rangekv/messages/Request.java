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
import rangekv.primitives.Txn;

/**
 * A request for a {@link rangekv.api.KeyValueService}, typed by the reply it produces. Requests are immutable;
 * restamping produces a copy through {@link #withHeader}.
 */
public abstract class Request<R extends Reply>
{
    public final RequestHeader header;

    protected Request(RequestHeader header)
    {
        this.header = header;
    }

    public abstract Method method();

    public abstract Request<R> withHeader(RequestHeader header);

    public Key key()
    {
        return header.key;
    }

    public Timestamp timestamp()
    {
        return header.timestamp;
    }

    public @Nullable Txn txn()
    {
        return header.txn;
    }

    @Override
    public String toString()
    {
        return method() + header.toString();
    }
}
