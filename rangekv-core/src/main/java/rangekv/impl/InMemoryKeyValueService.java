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

package rangekv.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangekv.api.Clock;
import rangekv.api.KeyValueService;
import rangekv.coordinate.ConditionFailed;
import rangekv.coordinate.TransactionAborted;
import rangekv.coordinate.TransactionRetry;
import rangekv.coordinate.WriteIntentConflict;
import rangekv.local.RangeAddressing;
import rangekv.local.RangeNotFound;
import rangekv.messages.AdminMerge;
import rangekv.messages.AdminMerge.AdminMergeReply;
import rangekv.messages.AdminSplit;
import rangekv.messages.AdminSplit.AdminSplitReply;
import rangekv.messages.ApplyBatch;
import rangekv.messages.ConditionalPut;
import rangekv.messages.Delete;
import rangekv.messages.DeleteRange;
import rangekv.messages.DeleteRange.DeleteRangeReply;
import rangekv.messages.EndTransaction;
import rangekv.messages.EndTransaction.EndTransactionReply;
import rangekv.messages.Get.GetReply;
import rangekv.messages.Increment;
import rangekv.messages.Increment.IncrementReply;
import rangekv.messages.Put;
import rangekv.messages.Reply;
import rangekv.messages.Request;
import rangekv.messages.Scan;
import rangekv.messages.Scan.ScanReply;
import rangekv.primitives.Batch;
import rangekv.primitives.ClientCmdId;
import rangekv.primitives.IsolationLevel;
import rangekv.primitives.Key;
import rangekv.primitives.KeyValue;
import rangekv.primitives.Mutation;
import rangekv.primitives.RangeDescriptor;
import rangekv.primitives.Timestamp;
import rangekv.primitives.Txn;
import rangekv.utils.async.AsyncResult;
import rangekv.utils.async.AsyncResults;

import static rangekv.utils.Invariants.checkArgument;
import static rangekv.utils.Invariants.illegalArgument;
import static rangekv.utils.Invariants.illegalState;

/**
 * A single node, multi-version key-value store held in memory, implementing enough of the storage contract
 * to run transactions end to end:
 * <ul>
 *     <li>transactional writes are held as intents, one per key, until the transaction commits or aborts</li>
 *     <li>an operation meeting another transaction's intent pushes it: the higher priority transaction wins, and
 *     a losing intent holder is aborted</li>
 *     <li>reads leave a mark that pushes later writes at or below the read timestamp; a serializable transaction
 *     must then restart, a snapshot transaction simply writes at the later timestamp</li>
 *     <li>range splits and merges maintain the addressing index through {@link RangeAddressing}</li>
 * </ul>
 * Replies complete before {@link #send} returns.
 * <p>
 * A transaction's record is dropped once its owner ends it, and replies kept for resent commands are bounded by
 * {@link #MAX_CACHED_REPLIES}. The record of a transaction aborted by a push is retained until its owner ends it,
 * so that the owner's later requests learn of the abort.
 */
public class InMemoryKeyValueService implements KeyValueService
{
    private static final Logger logger = LoggerFactory.getLogger(InMemoryKeyValueService.class);

    enum Status { PENDING, ABORTED }

    static final int MAX_CACHED_REPLIES = 10_000;

    static class Value
    {
        final @Nullable byte[] bytes;

        Value(@Nullable byte[] bytes)
        {
            this.bytes = bytes;
        }
    }

    static class Intent
    {
        final Txn txn;
        final @Nullable byte[] value;
        final Timestamp timestamp;

        Intent(Txn txn, @Nullable byte[] value, Timestamp timestamp)
        {
            this.txn = txn;
            this.value = value;
            this.timestamp = timestamp;
        }
    }

    static class TxnRecord
    {
        Txn txn;
        Status status = Status.PENDING;
        int abortedByPriority;
        final Set<Key> intents = new LinkedHashSet<>();

        TxnRecord(Txn txn)
        {
            this.txn = txn;
        }
    }

    /**
     * The two highest read timestamps of a key, from different readers, so that a transaction's own reads never
     * push its writes.
     */
    static class ReadMark
    {
        Timestamp first = Timestamp.NONE;
        @Nullable Key firstReader;
        Timestamp second = Timestamp.NONE;

        void record(Timestamp timestamp, @Nullable Key reader)
        {
            if (reader != null && reader.equals(firstReader))
            {
                first = Timestamp.max(first, timestamp);
            }
            else if (timestamp.compareTo(first) > 0)
            {
                second = first;
                first = timestamp;
                firstReader = reader;
            }
            else if (timestamp.compareTo(second) > 0)
            {
                second = timestamp;
            }
        }

        Timestamp maxExcluding(@Nullable Key reader)
        {
            return reader != null && reader.equals(firstReader) ? second : first;
        }
    }

    private final Clock clock;

    private final NavigableMap<Key, NavigableMap<Timestamp, Value>> data = new TreeMap<>();
    private final NavigableMap<Key, Intent> intents = new TreeMap<>();
    private final Map<Key, ReadMark> reads = new HashMap<>();
    private final Map<Key, TxnRecord> txns = new HashMap<>();
    private final Cache<ClientCmdId, Reply> replies = CacheBuilder.newBuilder().maximumSize(MAX_CACHED_REPLIES).build();
    // keyed by end key
    private final NavigableMap<Key, RangeDescriptor> ranges = new TreeMap<>();
    private long nextRangeId = 1;

    public InMemoryKeyValueService(Clock clock)
    {
        this.clock = clock;
        RangeDescriptor first = new RangeDescriptor(nextRangeId++, Key.MIN, Key.MAX);
        Batch batch = new Batch();
        RangeAddressing.update(batch, first);
        apply(batch.mutations(), clock.now(), null);
        ranges.put(first.endKey, first);
    }

    @Override
    public synchronized <R extends Reply> AsyncResult<R> send(Request<R> request)
    {
        try
        {
            ClientCmdId cmdId = request.header.cmdId;
            Reply previous = cmdId == null ? null : replies.getIfPresent(cmdId);
            if (previous != null)
            {
                logger.trace("Replaying reply to {}", request);
                return AsyncResults.success(cast(previous));
            }

            R reply = cast(execute(request));
            if (cmdId != null && !request.method().isReadOnly())
                replies.put(cmdId, reply);
            return AsyncResults.success(reply);
        }
        catch (RuntimeException e)
        {
            logger.trace("{} failed", request, e);
            return AsyncResults.failure(e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <R extends Reply> R cast(Reply reply)
    {
        return (R) reply;
    }

    private Reply execute(Request<?> request)
    {
        Timestamp timestamp = request.timestamp();
        if (timestamp.isNone()) timestamp = clock.now();
        else clock.update(timestamp);

        switch (request.method())
        {
            case END_TRANSACTION:
                return endTransaction((EndTransaction) request, timestamp);
            case ADMIN_SPLIT:
                return split(request.key());
            case ADMIN_MERGE:
                return merge(request.key());
        }

        Txn txn = request.txn();
        if (txn != null)
            txn = begin(txn);

        switch (request.method())
        {
            default: throw new AssertionError("Unhandled method " + request.method());
            case GET:
            {
                byte[] value = read(request.key(), timestamp, txn, true);
                return new GetReply(timestamp, value);
            }
            case SCAN:
            {
                Scan scan = (Scan) request;
                return new ScanReply(timestamp, scan(scan.key(), scan.endKey(), scan.maxResults, timestamp, txn));
            }
            case PUT:
            {
                Put put = (Put) request;
                return new Reply(write(put.key(), put.value(), timestamp, txn));
            }
            case CONDITIONAL_PUT:
            {
                ConditionalPut put = (ConditionalPut) request;
                byte[] actual = read(put.key(), timestamp, txn, false);
                if (!Arrays.equals(actual, put.expected()))
                    throw new ConditionFailed(put.key(), actual, timestamp);
                return new Reply(write(put.key(), put.value(), timestamp, txn));
            }
            case INCREMENT:
            {
                Increment increment = (Increment) request;
                byte[] current = read(increment.key(), timestamp, txn, false);
                long value = decodeLong(increment.key(), current) + increment.delta;
                return new IncrementReply(write(increment.key(), Longs.toByteArray(value), timestamp, txn), value);
            }
            case DELETE:
            {
                Delete delete = (Delete) request;
                return new Reply(write(delete.key(), null, timestamp, txn));
            }
            case DELETE_RANGE:
            {
                DeleteRange delete = (DeleteRange) request;
                List<KeyValue> existing = scan(delete.key(), delete.endKey(), 0, timestamp, txn);
                List<Mutation> deletes = new ArrayList<>(existing.size());
                for (KeyValue kv : existing)
                    deletes.add(Mutation.delete(kv.key));
                Timestamp executeAt = deletes.isEmpty() ? timestamp : apply(deletes, timestamp, txn);
                return new DeleteRangeReply(executeAt, deletes.size());
            }
            case BATCH:
            {
                ApplyBatch batch = (ApplyBatch) request;
                return new Reply(apply(batch.mutations, timestamp, txn));
            }
        }
    }

    private static long decodeLong(Key key, @Nullable byte[] bytes)
    {
        if (bytes == null)
            return 0;
        if (bytes.length != Long.BYTES)
            throw illegalArgument("Value at " + key + " is not an 8 byte integer");
        return Longs.fromByteArray(bytes);
    }

    /**
     * Register the transaction, failing if it has already been aborted
     */
    private Txn begin(Txn txn)
    {
        TxnRecord record = txns.get(txn.id);
        if (record == null)
        {
            record = new TxnRecord(txn);
            txns.put(txn.id, record);
            return txn;
        }

        switch (record.status)
        {
            default: throw new AssertionError("Unhandled status " + record.status);
            case ABORTED:
                throw new TransactionAborted(record.txn, record.abortedByPriority);
            case PENDING:
                record.txn = txn.upgradePriority(record.txn.priority);
                return record.txn;
        }
    }

    private @Nullable byte[] read(Key key, Timestamp timestamp, @Nullable Txn txn, boolean mark)
    {
        Intent intent = intents.get(key);
        if (intent != null)
        {
            if (txn != null && intent.txn.isSameTxn(txn))
            {
                if (intent.txn.epoch == txn.epoch)
                {
                    if (mark) markRead(key, timestamp, txn);
                    return intent.value == null ? null : intent.value.clone();
                }
                // written by an earlier epoch, so invisible to this one
            }
            else if (!intent.timestamp.isAfter(timestamp))
            {
                push(key, intent, txn);
            }
        }

        if (mark) markRead(key, timestamp, txn);
        NavigableMap<Timestamp, Value> versions = data.get(key);
        if (versions == null)
            return null;
        Map.Entry<Timestamp, Value> version = versions.floorEntry(timestamp);
        if (version == null || version.getValue().bytes == null)
            return null;
        return version.getValue().bytes.clone();
    }

    private void markRead(Key key, Timestamp timestamp, @Nullable Txn txn)
    {
        reads.computeIfAbsent(key, ignore -> new ReadMark()).record(timestamp, txn == null ? null : txn.id);
    }

    private List<KeyValue> scan(Key start, Key end, int maxResults, Timestamp timestamp, @Nullable Txn txn)
    {
        TreeSet<Key> keys = new TreeSet<>(data.subMap(start, true, end, false).keySet());
        keys.addAll(intents.subMap(start, true, end, false).keySet());

        List<KeyValue> rows = new ArrayList<>();
        for (Key key : keys)
        {
            byte[] value = read(key, timestamp, txn, true);
            if (value == null)
                continue;
            rows.add(new KeyValue(key, value, timestamp));
            if (maxResults > 0 && rows.size() == maxResults)
                break;
        }
        return rows;
    }

    /**
     * Resolve a conflict with another transaction's intent, by aborting its owner if {@code pusher} outranks it.
     * Always throws, as the operation must be retried either way.
     */
    private void push(Key key, Intent intent, @Nullable Txn pusher)
    {
        TxnRecord pushee = txns.get(intent.txn.id);
        if (pusher != null && outranks(pusher, pushee.txn))
        {
            logger.debug("{} aborting {} to resolve intent on {}", pusher, pushee.txn, key);
            abort(pushee, pusher.priority);
            throw new WriteIntentConflict(key, pushee.txn, true);
        }
        throw new WriteIntentConflict(key, pushee.txn, false);
    }

    private static boolean outranks(Txn pusher, Txn pushee)
    {
        if (pusher.priority != pushee.priority)
            return pusher.priority > pushee.priority;
        int c = pusher.timestamp.compareTo(pushee.timestamp);
        if (c != 0)
            return c < 0;
        return pusher.id.compareTo(pushee.id) < 0;
    }

    private void abort(TxnRecord record, int byPriority)
    {
        record.status = Status.ABORTED;
        record.abortedByPriority = byPriority;
        removeIntents(record);
    }

    private void removeIntents(TxnRecord record)
    {
        for (Key key : record.intents)
        {
            Intent intent = intents.get(key);
            if (intent != null && intent.txn.isSameTxn(record.txn))
                intents.remove(key);
        }
        record.intents.clear();
    }

    /**
     * Check a write of {@code key} may go ahead, returning the timestamp it must be written at
     */
    private Timestamp checkWrite(Key key, Timestamp timestamp, @Nullable Txn txn)
    {
        Intent intent = intents.get(key);
        if (intent != null && (txn == null || !intent.txn.isSameTxn(txn)))
            push(key, intent, txn);

        NavigableMap<Timestamp, Value> versions = data.get(key);
        Timestamp latest = versions == null ? Timestamp.NONE : versions.lastKey();
        ReadMark mark = reads.get(key);
        Timestamp lastRead = mark == null ? Timestamp.NONE : mark.maxExcluding(txn == null ? null : txn.id);

        if (txn == null)
            return Timestamp.max(timestamp, Timestamp.max(latest, lastRead).next());

        if (!latest.isBefore(timestamp))
            throw new TransactionRetry(txn.withTimestamp(latest.next()), "write of " + key + " too old");

        if (lastRead.isBefore(timestamp))
            return timestamp;

        if (txn.isolation == IsolationLevel.SERIALIZABLE)
            throw new TransactionRetry(txn.withTimestamp(lastRead.next()), key + " read at " + lastRead);
        return lastRead.next();
    }

    private Timestamp write(Key key, @Nullable byte[] value, Timestamp timestamp, @Nullable Txn txn)
    {
        Timestamp executeAt = checkWrite(key, timestamp, txn);
        doWrite(key, value, executeAt, txn);
        return executeAt;
    }

    private void doWrite(Key key, @Nullable byte[] value, Timestamp executeAt, @Nullable Txn txn)
    {
        if (txn == null)
        {
            data.computeIfAbsent(key, ignore -> new TreeMap<>()).put(executeAt, new Value(value));
            return;
        }

        intents.put(key, new Intent(txn, value, executeAt));
        txns.get(txn.id).intents.add(key);
    }

    /**
     * Check every mutation before applying any of them
     */
    private Timestamp apply(List<Mutation> mutations, Timestamp timestamp, @Nullable Txn txn)
    {
        List<Timestamp> executeAts = new ArrayList<>(mutations.size());
        Timestamp max = timestamp;
        for (Mutation mutation : mutations)
        {
            Timestamp executeAt = checkWrite(mutation.key, timestamp, txn);
            executeAts.add(executeAt);
            max = Timestamp.max(max, executeAt);
        }

        // non-transactional batches become visible at a single timestamp
        for (int i = 0 ; i < mutations.size() ; ++i)
        {
            Mutation mutation = mutations.get(i);
            doWrite(mutation.key, mutation.value(), txn == null ? max : executeAts.get(i), txn);
        }
        return max;
    }

    private EndTransactionReply endTransaction(EndTransaction request, Timestamp timestamp)
    {
        Txn txn = request.txn();
        checkArgument(txn != null, "EndTransaction without a transaction");
        TxnRecord record = txns.get(txn.id);
        if (record == null)
        {
            record = new TxnRecord(txn);
            txns.put(txn.id, record);
        }

        if (record.status == Status.ABORTED)
        {
            if (request.commit)
                throw new TransactionAborted(record.txn, record.abortedByPriority);
            txns.remove(txn.id);
            return new EndTransactionReply(timestamp, record.txn);
        }

        if (!request.commit)
        {
            abort(record, txn.priority);
            txns.remove(txn.id);
            logger.trace("Aborted {}", txn);
            return new EndTransactionReply(timestamp, txn);
        }

        // only the latest epoch's intents are committed, at a timestamp no earlier than any of them
        Timestamp commitAt = timestamp;
        Map<Key, Intent> committing = new LinkedHashMap<>();
        for (Key key : record.intents)
        {
            Intent intent = intents.get(key);
            if (intent == null || !intent.txn.isSameTxn(txn) || intent.txn.epoch != txn.epoch)
                continue;
            committing.put(key, intent);
            commitAt = Timestamp.max(commitAt, intent.timestamp);
        }

        for (Map.Entry<Key, Intent> e : committing.entrySet())
            data.computeIfAbsent(e.getKey(), ignore -> new TreeMap<>()).put(commitAt, new Value(e.getValue().value));
        removeIntents(record);
        txns.remove(txn.id);
        Txn committed = txn.withTimestamp(commitAt);
        logger.trace("Committed {} writing {} keys", committed, committing.size());
        return new EndTransactionReply(commitAt, committed);
    }

    private RangeDescriptor rangeFor(Key key)
    {
        Map.Entry<Key, RangeDescriptor> entry = ranges.higherEntry(key);
        if (entry == null || !entry.getValue().containsKey(key))
            throw new RangeNotFound(key, "outside the key space");
        return entry.getValue();
    }

    private AdminSplitReply split(Key splitKey)
    {
        RangeDescriptor original = rangeFor(splitKey);
        if (original.startKey.equals(splitKey))
            throw illegalArgument(splitKey + " is already the start of " + original);

        RangeDescriptor left = new RangeDescriptor(original.rangeId, original.startKey, splitKey);
        RangeDescriptor right = new RangeDescriptor(nextRangeId, splitKey, original.endKey);
        Batch batch = new Batch();
        RangeAddressing.onSplit(batch, original, left, right);
        Timestamp executeAt = apply(batch.mutations(), clock.now(), null);

        ++nextRangeId;
        ranges.put(left.endKey, left);
        ranges.put(right.endKey, right);
        logger.info("Split {} into {} and {}", original, left, right);
        return new AdminSplitReply(executeAt, left, right);
    }

    private AdminMergeReply merge(Key key)
    {
        RangeDescriptor left = rangeFor(key);
        Map.Entry<Key, RangeDescriptor> next = ranges.higherEntry(left.endKey);
        if (next == null)
            throw new RangeNotFound(left.endKey, "no range follows " + left);

        RangeDescriptor right = next.getValue();
        if (!right.startKey.equals(left.endKey))
            throw illegalState(left + " and " + right + " are not adjacent");
        RangeDescriptor merged = new RangeDescriptor(left.rangeId, left.startKey, right.endKey);
        Batch batch = new Batch();
        RangeAddressing.onMerge(batch, left, right, merged);
        Timestamp executeAt = apply(batch.mutations(), clock.now(), null);

        ranges.remove(left.endKey);
        ranges.put(merged.endKey, merged);
        logger.info("Merged {} and {} into {}", left, right, merged);
        return new AdminMergeReply(executeAt, merged);
    }

    @VisibleForTesting
    public synchronized List<RangeDescriptor> ranges()
    {
        return ImmutableList.copyOf(ranges.values());
    }

    @VisibleForTesting
    public synchronized int txnCount()
    {
        return txns.size();
    }

    @VisibleForTesting
    public synchronized int intentCount()
    {
        return intents.size();
    }
}
