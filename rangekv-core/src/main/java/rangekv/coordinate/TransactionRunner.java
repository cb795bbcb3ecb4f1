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

import java.util.function.Supplier;

import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangekv.utils.async.AsyncResults;

/**
 * Runs a block of transactional logic to completion: re-running it for as long as it fails with a
 * {@link TransactionRetry} or {@link TransactionAborted}, then committing, or aborting if it fails in any other way.
 */
public class TransactionRunner
{
    private static final Logger logger = LoggerFactory.getLogger(TransactionRunner.class);

    /**
     * Logic run within a transaction. May be invoked more than once, so must have no effects outside the session.
     */
    public interface Retryable<S>
    {
        void run(S session);
    }

    private TransactionRunner() {}

    public static <S extends Session> void run(Supplier<S> sessions, Retryable<? super S> retryable)
    {
        S session = sessions.get();
        int attempt = 0;
        while (true)
        {
            try
            {
                retryable.run(session);
                break;
            }
            catch (TransactionRetry | TransactionAborted conflict)
            {
                logger.debug("Re-running transaction (attempt {}): {}", ++attempt, conflict.getMessage());
            }
            catch (Throwable failure)
            {
                try
                {
                    AsyncResults.getUnchecked(session.abort());
                }
                catch (Throwable abortFailure)
                {
                    throw new AbortFailed(failure, abortFailure);
                }
                Throwables.throwIfUnchecked(failure);
                throw new RuntimeException(failure);
            }
        }
        AsyncResults.getUnchecked(session.commit());
    }
}
