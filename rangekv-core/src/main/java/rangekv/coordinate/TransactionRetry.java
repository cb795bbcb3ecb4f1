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

package rangekv.coordinate;

import rangekv.primitives.Txn;

/**
 * The transaction cannot proceed at its current timestamp and must restart at a later one, keeping its identity.
 * {@link #txn} is the transaction as the service last knew it, with its timestamp pushed forward.
 */
public class TransactionRetry extends KeyValueFailure
{
    public final Txn txn;

    public TransactionRetry(Txn txn, String reason)
    {
        super(txn.timestamp, "Retry " + txn + ": " + reason);
        this.txn = txn;
    }
}
