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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangekv.api.Clock;
import rangekv.api.KeyValueService;
import rangekv.api.Scheduler;
import rangekv.messages.EndTransaction;
import rangekv.messages.Reply;
import rangekv.messages.Request;
import rangekv.messages.RequestHeader;
import rangekv.primitives.ClientCmdId;
import rangekv.primitives.IsolationLevel;
import rangekv.primitives.Timestamp;
import rangekv.primitives.Txn;
import rangekv.utils.Backoff;
import rangekv.utils.RetryOptions;
import rangekv.utils.async.AsyncResult;
import rangekv.utils.async.AsyncResults;

/**
 * Coordinates one transaction over a {@link KeyValueService}. Every request sent through the coordinator is
 * stamped with the transaction, its timestamp and (for writes) a fresh idempotency token; write intent conflicts
 * are retried here, while retry and abort conflicts update the transaction and are then reported to the caller,
 * who is expected to re-run its logic (see {@link TransactionRunner}).
 *
 * The transaction record is created lazily, anchored at the key of the first operation. Operations may be issued
 * concurrently; {@link #commit()} and {@link #abort()} wait for all of them to complete before finishing the
 * transaction.
 */
public class TxnCoordinator implements KeyValueService, Session
{
    private static final Logger logger = LoggerFactory.getLogger(TxnCoordinator.class);

    private final KeyValueService service;
    private final Clock clock;
    private final Scheduler scheduler;
    private final RetryOptions retry;
    private final String user;
    private final int userPriority;
    private final IsolationLevel isolation;

    private final Lock lock = new ReentrantLock();
    private final InflightTracker inflight = new InflightTracker();

    // guarded by lock
    private @Nullable Txn txn;
    private Timestamp timestamp = Timestamp.NONE;
    private boolean done;

    public TxnCoordinator(KeyValueService service, Clock clock, Scheduler scheduler, RetryOptions retry,
                          String user, int userPriority, IsolationLevel isolation)
    {
        this.service = service;
        this.clock = clock;
        this.scheduler = scheduler;
        this.retry = retry;
        this.user = user;
        this.userPriority = userPriority;
        this.isolation = isolation;
    }

    class Operation<R extends Reply> extends AsyncResults.Settable<R> implements BiConsumer<R, Throwable>
    {
        final Request<R> request;
        final Backoff backoff = retry.newBackoff();
        Request<R> sent;

        Operation(Request<R> request)
        {
            this.request = request;
        }

        void attempt()
        {
            lock.lock();
            try
            {
                sent = request.withHeader(stamp(request));
            }
            finally
            {
                lock.unlock();
            }

            AsyncResult<R> result;
            try
            {
                result = service.send(sent);
            }
            catch (Throwable t)
            {
                accept(null, t);
                return;
            }
            result.addCallback(this);
        }

        @Override
        public void accept(R reply, Throwable failure)
        {
            Conflict conflict = Conflict.classify(failure);
            switch (conflict.kind)
            {
                case WRITE_INTENT:
                    onWriteIntent(conflict, (WriteIntentConflict) failure);
                    return;
                case RETRY:
                    onRetry(conflict);
                    break;
                case ABORTED:
                    onAborted(conflict);
            }

            lock.lock();
            try
            {
                Timestamp observed = observedTimestamp(reply, failure);
                if (observed != null)
                    timestamp = Timestamp.max(timestamp, observed);
            }
            finally
            {
                lock.unlock();
            }

            if (failure == null) trySuccess(reply);
            else tryFailure(failure);
            inflight.end();
        }

        private void onWriteIntent(Conflict conflict, WriteIntentConflict failure)
        {
            if (conflict.resolved)
            {
                logger.trace("{} met a resolved intent; retrying", sent);
                backoff.reset();
                attempt();
                return;
            }

            lock.lock();
            try
            {
                txn = txn.upgradePriority(conflict.conflictingPriority - 1);
            }
            finally
            {
                lock.unlock();
            }

            if (backoff.isExhausted())
            {
                tryFailure(new Exhausted(sent + " gave up after " + backoff.attempts() + " attempts", failure));
                inflight.end();
                return;
            }

            long delayMicros = backoff.nextDelayMicros();
            logger.debug("{} blocked by {}; retrying in {}us", sent, failure.conflicting, delayMicros);
            scheduler.once(this::attempt, delayMicros, TimeUnit.MICROSECONDS);
        }

        private void onRetry(Conflict conflict)
        {
            lock.lock();
            try
            {
                txn = conflict.txn.nextEpoch(Timestamp.max(sent.timestamp(), timestamp));
                timestamp = txn.timestamp;
                logger.debug("Restarting {} at epoch {}", txn, txn.epoch);
            }
            finally
            {
                lock.unlock();
            }
        }

        private void onAborted(Conflict conflict)
        {
            lock.lock();
            try
            {
                Txn restarted = Txn.create(txn.key, userPriority, isolation, clock)
                                   .upgradePriority(Math.max(txn.priority, conflict.conflictingPriority));
                timestamp = Timestamp.max(timestamp, restarted.timestamp);
                txn = restarted.withTimestamp(timestamp);
                logger.debug("Replacing aborted transaction with {}", txn);
            }
            finally
            {
                lock.unlock();
            }
        }
    }

    private static @Nullable Timestamp observedTimestamp(Reply reply, Throwable failure)
    {
        if (failure == null)
            return reply.timestamp;
        if (failure instanceof KeyValueFailure)
            return ((KeyValueFailure) failure).timestamp();
        return null;
    }

    // must hold lock
    private RequestHeader stamp(Request<?> request)
    {
        RequestHeader header = request.header.withUser(user).withTimestamp(timestamp).withTxn(txn);
        if (!request.method().isReadOnly())
            header = header.withCmdId(ClientCmdId.next(clock.now()));
        return header;
    }

    @Override
    public <R extends Reply> AsyncResult<R> send(Request<R> request)
    {
        lock.lock();
        try
        {
            if (done)
                return AsyncResults.failure(new TransactionClosed(txn));
            if (!request.method().isTransactional())
                return AsyncResults.failure(new NotTransactional(request.method()));

            if (txn == null)
            {
                txn = Txn.create(request.key(), userPriority, isolation, clock);
                timestamp = txn.timestamp;
                logger.trace("Started {}", txn);
            }
            inflight.begin();
        }
        finally
        {
            lock.unlock();
        }

        Operation<R> operation = new Operation<>(request);
        operation.attempt();
        return operation;
    }

    @Override
    public AsyncResult<Void> commit()
    {
        return finish(true);
    }

    @Override
    public AsyncResult<Void> abort()
    {
        return finish(false);
    }

    private AsyncResult<Void> finish(boolean commit)
    {
        lock.lock();
        try
        {
            if (done)
                return AsyncResults.failure(new TransactionClosed(txn));
            done = true;
        }
        finally
        {
            lock.unlock();
        }

        AsyncResult.Settable<Void> result = AsyncResults.settable();
        inflight.whenDrained(() -> {
            EndTransaction request;
            lock.lock();
            try
            {
                if (txn == null)
                {
                    result.setSuccess(null);
                    return;
                }
                request = new EndTransaction(txn, user, timestamp, commit);
            }
            finally
            {
                lock.unlock();
            }

            logger.trace("Finishing with {}", request);
            AsyncResult<EndTransaction.EndTransactionReply> sent;
            try
            {
                sent = service.send(request);
            }
            catch (Throwable t)
            {
                result.setFailure(t);
                return;
            }
            sent.addCallback((reply, failure) -> {
                if (failure != null)
                {
                    result.setFailure(failure);
                    return;
                }
                lock.lock();
                try
                {
                    timestamp = Timestamp.max(timestamp, reply.timestamp);
                    txn = reply.txn;
                }
                finally
                {
                    lock.unlock();
                }
                result.setSuccess(null);
            });
        });
        return result;
    }

    @VisibleForTesting
    public @Nullable Txn txn()
    {
        lock.lock();
        try
        {
            return txn;
        }
        finally
        {
            lock.unlock();
        }
    }

    @VisibleForTesting
    public Timestamp timestamp()
    {
        lock.lock();
        try
        {
            return timestamp;
        }
        finally
        {
            lock.unlock();
        }
    }

    public boolean isDone()
    {
        lock.lock();
        try
        {
            return done;
        }
        finally
        {
            lock.unlock();
        }
    }
}
