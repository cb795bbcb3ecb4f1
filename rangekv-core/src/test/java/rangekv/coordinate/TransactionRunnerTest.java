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

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import rangekv.primitives.IsolationLevel;
import rangekv.primitives.Key;
import rangekv.primitives.Timestamp;
import rangekv.primitives.Txn;
import rangekv.utils.async.AsyncResult;
import rangekv.utils.async.AsyncResults;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionRunnerTest
{
    static class CountingSession implements Session
    {
        int commits, aborts;
        RuntimeException commitFailure, abortFailure;

        @Override
        public AsyncResult<Void> commit()
        {
            ++commits;
            return commitFailure == null ? AsyncResults.success(null) : AsyncResults.failure(commitFailure);
        }

        @Override
        public AsyncResult<Void> abort()
        {
            ++aborts;
            return abortFailure == null ? AsyncResults.success(null) : AsyncResults.failure(abortFailure);
        }
    }

    private static final Txn TXN = new Txn(Key.of("id"), Key.of("k"), 0, 1, IsolationLevel.SERIALIZABLE, Timestamp.of(1, 0));

    @Test
    void rerunsOnConflictsThenCommits()
    {
        CountingSession session = new CountingSession();
        AtomicInteger sessions = new AtomicInteger();
        AtomicInteger runs = new AtomicInteger();
        TransactionRunner.run(() -> { sessions.incrementAndGet(); return session; }, s -> {
            switch (runs.incrementAndGet())
            {
                case 1: throw new TransactionRetry(TXN, "test");
                case 2: throw new TransactionAborted(TXN, 10);
            }
        });

        assertThat(runs.get()).isEqualTo(3);
        assertThat(sessions.get()).isEqualTo(1);
        assertThat(session.commits).isEqualTo(1);
        assertThat(session.aborts).isZero();
    }

    @Test
    void abortsOnFailure()
    {
        CountingSession session = new CountingSession();
        IllegalStateException failure = new IllegalStateException("boom");
        assertThatThrownBy(() -> TransactionRunner.run(() -> session, s -> { throw failure; })).isSameAs(failure);
        assertThat(session.aborts).isEqualTo(1);
        assertThat(session.commits).isZero();
    }

    @Test
    void abortsOnError()
    {
        CountingSession session = new CountingSession();
        AssertionError failure = new AssertionError("boom");
        assertThatThrownBy(() -> TransactionRunner.run(() -> session, s -> { throw failure; })).isSameAs(failure);
        assertThat(session.aborts).isEqualTo(1);
        assertThat(session.commits).isZero();
    }

    @Test
    void reportsBothFailuresWhenAbortFails()
    {
        CountingSession session = new CountingSession();
        session.abortFailure = new IllegalStateException("abort");
        ConditionFailed failure = new ConditionFailed(Key.of("k"), null, Timestamp.of(1, 0));

        assertThatThrownBy(() -> TransactionRunner.run(() -> session, s -> { throw failure; }))
            .isInstanceOfSatisfying(AbortFailed.class, abortFailed -> {
                assertThat(abortFailed.original()).isSameAs(failure);
                assertThat(abortFailed.abortFailure()).isSameAs(session.abortFailure);
            })
            .hasMessageContaining("after error " + failure.getMessage())
            .hasMessageContaining("failed abort: abort");
    }

    @Test
    void reportsCommitFailure()
    {
        CountingSession session = new CountingSession();
        session.commitFailure = new TransactionAborted(TXN, 10);
        AtomicInteger runs = new AtomicInteger();
        assertThatThrownBy(() -> TransactionRunner.run(() -> session, s -> runs.incrementAndGet()))
            .isSameAs(session.commitFailure);
        assertThat(runs.get()).isEqualTo(1);
        assertThat(session.aborts).isZero();
    }
}
