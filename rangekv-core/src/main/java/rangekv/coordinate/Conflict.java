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

import javax.annotation.Nullable;

import rangekv.primitives.Txn;

/**
 * The outcome of an operation as far as the coordinator's retry logic is concerned.
 */
final class Conflict
{
    enum Kind
    {
        /** blocked by another transaction's intent */
        WRITE_INTENT,
        /** must restart at a later timestamp under the same identity */
        RETRY,
        /** must restart under a new identity */
        ABORTED,
        NONE
    }

    static final Conflict NONE = new Conflict(Kind.NONE, false, 0, null);

    final Kind kind;
    final boolean resolved;
    final int conflictingPriority;
    final @Nullable Txn txn;

    private Conflict(Kind kind, boolean resolved, int conflictingPriority, @Nullable Txn txn)
    {
        this.kind = kind;
        this.resolved = resolved;
        this.conflictingPriority = conflictingPriority;
        this.txn = txn;
    }

    static Conflict classify(@Nullable Throwable failure)
    {
        if (failure instanceof WriteIntentConflict)
        {
            WriteIntentConflict conflict = (WriteIntentConflict) failure;
            return new Conflict(Kind.WRITE_INTENT, conflict.resolved, conflict.conflicting.priority, null);
        }
        if (failure instanceof TransactionRetry)
            return new Conflict(Kind.RETRY, false, 0, ((TransactionRetry) failure).txn);
        if (failure instanceof TransactionAborted)
            return new Conflict(Kind.ABORTED, false, ((TransactionAborted) failure).conflictingPriority, null);
        return NONE;
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            case WRITE_INTENT: return "WriteIntent{resolved=" + resolved + ", priority=" + conflictingPriority + '}';
            case RETRY: return "Retry{" + txn + '}';
            case ABORTED: return "Aborted{priority=" + conflictingPriority + '}';
            default: return "None";
        }
    }
}
