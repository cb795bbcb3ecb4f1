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

import rangekv.primitives.Timestamp;
import rangekv.primitives.Txn;

/**
 * Commits or aborts the transaction in the header, finalising it at the header timestamp
 */
public class EndTransaction extends Request<EndTransaction.EndTransactionReply>
{
    public static class EndTransactionReply extends Reply
    {
        public final Txn txn;

        public EndTransactionReply(Timestamp timestamp, Txn txn)
        {
            super(timestamp);
            this.txn = txn;
        }
    }

    public final boolean commit;

    public EndTransaction(Txn txn, String user, Timestamp timestamp, boolean commit)
    {
        this(RequestHeader.of(txn.id).withUser(user).withTimestamp(timestamp).withTxn(txn), commit);
    }

    private EndTransaction(RequestHeader header, boolean commit)
    {
        super(header);
        this.commit = commit;
    }

    @Override
    public Method method()
    {
        return Method.END_TRANSACTION;
    }

    @Override
    public EndTransaction withHeader(RequestHeader header)
    {
        return new EndTransaction(header, commit);
    }

    @Override
    public String toString()
    {
        return (commit ? "COMMIT" : "ABORT") + header;
    }
}
