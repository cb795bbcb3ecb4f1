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

package rangekv.client;

import rangekv.api.LocalConfig;
import rangekv.primitives.IsolationLevel;

/**
 * The parameters of a transaction. A negative user priority requests that exact (positive) priority;
 * otherwise larger values make a transaction more likely to win conflicts.
 */
public class TxnOptions
{
    public final String user;
    public final int userPriority;
    public final IsolationLevel isolation;

    public TxnOptions(String user, int userPriority, IsolationLevel isolation)
    {
        this.user = user;
        this.userPriority = userPriority;
        this.isolation = isolation;
    }

    public static TxnOptions defaults(LocalConfig config)
    {
        return new TxnOptions(config.defaultUser(), config.defaultUserPriority(), config.defaultIsolation());
    }

    public TxnOptions withUser(String user)
    {
        return new TxnOptions(user, userPriority, isolation);
    }

    public TxnOptions withUserPriority(int userPriority)
    {
        return new TxnOptions(user, userPriority, isolation);
    }

    public TxnOptions withIsolation(IsolationLevel isolation)
    {
        return new TxnOptions(user, userPriority, isolation);
    }

    @Override
    public String toString()
    {
        return "TxnOptions{user=" + user + ", priority=" + userPriority + ", isolation=" + isolation + '}';
    }
}
