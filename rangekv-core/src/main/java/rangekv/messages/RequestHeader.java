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

import rangekv.primitives.ClientCmdId;
import rangekv.primitives.Key;
import rangekv.primitives.Timestamp;
import rangekv.primitives.Txn;

/**
 * Addressing and transactional context common to every request. {@link Timestamp#NONE} asks the service
 * to pick the timestamp itself.
 */
public final class RequestHeader
{
    public final Key key;
    public final @Nullable Key endKey;
    public final @Nullable String user;
    public final Timestamp timestamp;
    public final @Nullable Txn txn;
    public final @Nullable ClientCmdId cmdId;

    private RequestHeader(Key key, @Nullable Key endKey, @Nullable String user, Timestamp timestamp, @Nullable Txn txn, @Nullable ClientCmdId cmdId)
    {
        this.key = key;
        this.endKey = endKey;
        this.user = user;
        this.timestamp = timestamp;
        this.txn = txn;
        this.cmdId = cmdId;
    }

    public static RequestHeader of(Key key)
    {
        return new RequestHeader(key, null, null, Timestamp.NONE, null, null);
    }

    public static RequestHeader of(Key key, Key endKey)
    {
        return new RequestHeader(key, endKey, null, Timestamp.NONE, null, null);
    }

    public RequestHeader withUser(String user)
    {
        return new RequestHeader(key, endKey, user, timestamp, txn, cmdId);
    }

    public RequestHeader withTimestamp(Timestamp timestamp)
    {
        return new RequestHeader(key, endKey, user, timestamp, txn, cmdId);
    }

    public RequestHeader withTxn(@Nullable Txn txn)
    {
        return new RequestHeader(key, endKey, user, timestamp, txn, cmdId);
    }

    public RequestHeader withCmdId(@Nullable ClientCmdId cmdId)
    {
        return new RequestHeader(key, endKey, user, timestamp, txn, cmdId);
    }

    @Override
    public String toString()
    {
        return "{key=" + key + (endKey == null ? "" : ", endKey=" + endKey)
               + ", ts=" + timestamp + (txn == null ? "" : ", txn=" + txn) + '}';
    }
}
