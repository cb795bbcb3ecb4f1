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

import com.google.common.annotations.VisibleForTesting;

import rangekv.coordinate.Session;
import rangekv.coordinate.TransactionRunner.Retryable;
import rangekv.coordinate.TxnCoordinator;
import rangekv.messages.Reply;
import rangekv.messages.Request;
import rangekv.utils.async.AsyncResult;
import rangekv.utils.async.AsyncResults;

import static rangekv.utils.Invariants.illegalState;

/**
 * A {@link DB} whose operations all run within one transaction
 */
public class TxnDB extends DB implements Session
{
    private final TxnCoordinator coordinator;
    private final TxnOptions options;

    TxnDB(TxnCoordinator coordinator, DB db, TxnOptions options)
    {
        super(coordinator, db.service, db.clock, db.scheduler, db.config);
        this.coordinator = coordinator;
        this.options = options;
    }

    @Override
    protected <R extends Reply> R send(Request<R> request)
    {
        // the coordinator stamps the user
        return AsyncResults.getUnchecked(coordinator.send(request));
    }

    @Override
    public AsyncResult<Void> commit()
    {
        return coordinator.commit();
    }

    @Override
    public AsyncResult<Void> abort()
    {
        return coordinator.abort();
    }

    @Override
    public TxnDB newTxn(TxnOptions options)
    {
        throw illegalState("Transactions may not be nested");
    }

    @Override
    public void runTransaction(TxnOptions options, Retryable<? super TxnDB> retryable)
    {
        throw illegalState("Transactions may not be nested");
    }

    public TxnOptions options()
    {
        return options;
    }

    @VisibleForTesting
    TxnCoordinator coordinator()
    {
        return coordinator;
    }
}
