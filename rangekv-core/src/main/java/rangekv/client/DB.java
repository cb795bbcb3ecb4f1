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

import java.util.List;
import javax.annotation.Nullable;

import rangekv.api.Clock;
import rangekv.api.KeyValueService;
import rangekv.api.LocalConfig;
import rangekv.api.Scheduler;
import rangekv.coordinate.TransactionRunner;
import rangekv.coordinate.TransactionRunner.Retryable;
import rangekv.coordinate.TxnCoordinator;
import rangekv.local.RangeLookup;
import rangekv.messages.AdminMerge;
import rangekv.messages.AdminSplit;
import rangekv.messages.AdminSplit.AdminSplitReply;
import rangekv.messages.ApplyBatch;
import rangekv.messages.ConditionalPut;
import rangekv.messages.Delete;
import rangekv.messages.DeleteRange;
import rangekv.messages.Get;
import rangekv.messages.Increment;
import rangekv.messages.Put;
import rangekv.messages.Reply;
import rangekv.messages.Request;
import rangekv.messages.Scan;
import rangekv.primitives.Batch;
import rangekv.primitives.Key;
import rangekv.primitives.KeyValue;
import rangekv.primitives.RangeDescriptor;
import rangekv.utils.async.AsyncResults;

/**
 * Blocking client for a {@link KeyValueService}. Operations issued directly on a {@code DB} are not
 * transactional; each takes effect on its own. Transactions are run through {@link #runTransaction}, which
 * passes the logic a {@link TxnDB} whose operations all belong to the one transaction.
 *
 * Failures are rethrown as the {@link rangekv.coordinate.KeyValueFailure} reported by the service.
 */
public class DB
{
    private final KeyValueService sender;
    protected final KeyValueService service;
    protected final Clock clock;
    protected final Scheduler scheduler;
    protected final LocalConfig config;

    public DB(KeyValueService service, Clock clock, Scheduler scheduler, LocalConfig config)
    {
        this(service, service, clock, scheduler, config);
    }

    DB(KeyValueService sender, KeyValueService service, Clock clock, Scheduler scheduler, LocalConfig config)
    {
        this.sender = sender;
        this.service = service;
        this.clock = clock;
        this.scheduler = scheduler;
        this.config = config;
    }

    protected <R extends Reply> R send(Request<R> request)
    {
        return AsyncResults.getUnchecked(sender.send(request.withHeader(request.header.withUser(config.defaultUser()))));
    }

    /**
     * @return the value of {@code key}, or null if it has none
     */
    public @Nullable byte[] get(Key key)
    {
        return send(new Get(key)).value();
    }

    public void put(Key key, byte[] value)
    {
        send(new Put(key, value));
    }

    /**
     * Write {@code value} only if the key currently holds {@code expected}, or has no value if {@code expected}
     * is null
     *
     * @throws rangekv.coordinate.ConditionFailed if the current value differs
     */
    public void conditionalPut(Key key, byte[] value, @Nullable byte[] expected)
    {
        send(new ConditionalPut(key, value, expected));
    }

    /**
     * @return the value after incrementing
     */
    public long increment(Key key, long delta)
    {
        return send(new Increment(key, delta)).newValue;
    }

    public void delete(Key key)
    {
        send(new Delete(key));
    }

    /**
     * @return the number of keys deleted from {@code [start, end)}
     */
    public int deleteRange(Key start, Key end)
    {
        return send(new DeleteRange(start, end)).deleted;
    }

    /**
     * @param maxResults the maximum number of rows to return, or zero for all
     */
    public List<KeyValue> scan(Key start, Key end, int maxResults)
    {
        return send(new Scan(start, end, maxResults)).rows;
    }

    /**
     * Apply the puts and deletes of {@code batch} atomically
     */
    public void run(Batch batch)
    {
        if (batch.isEmpty())
            return;
        send(new ApplyBatch(batch));
    }

    public AdminSplitReply adminSplit(Key splitKey)
    {
        return send(new AdminSplit(splitKey));
    }

    /**
     * Merge the range containing {@code key} with its right-hand neighbour
     * @return the merged range
     */
    public RangeDescriptor adminMerge(Key key)
    {
        return send(new AdminMerge(key)).merged;
    }

    /**
     * @return the range owning {@code key}, according to the addressing index
     */
    public RangeDescriptor lookupRange(Key key)
    {
        return AsyncResults.getUnchecked(RangeLookup.lookup(service, key));
    }

    /**
     * Start a transaction which the caller must finish with {@link TxnDB#commit()} or {@link TxnDB#abort()}
     */
    public TxnDB newTxn(TxnOptions options)
    {
        TxnCoordinator coordinator = new TxnCoordinator(service, clock, scheduler, config.writeIntentRetry(),
                                                        options.user, options.userPriority, options.isolation);
        return new TxnDB(coordinator, this, options);
    }

    /**
     * Run {@code retryable} in a transaction, re-running it as often as conflicts require, then commit.
     * The transaction is aborted if {@code retryable} throws, and the failure rethrown.
     */
    public void runTransaction(TxnOptions options, Retryable<? super TxnDB> retryable)
    {
        TransactionRunner.run(() -> newTxn(options), retryable);
    }

    public void runTransaction(Retryable<? super TxnDB> retryable)
    {
        runTransaction(TxnOptions.defaults(config), retryable);
    }
}
