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

package rangekv.api;

import rangekv.primitives.IsolationLevel;
import rangekv.utils.RetryOptions;

public interface LocalConfig
{
    LocalConfig DEFAULT = new LocalConfig() {};

    /**
     * Backoff for operations blocked behind another transaction's write intent. Unbounded unless
     * {@link RetryOptions#maxAttempts} is set.
     */
    default RetryOptions writeIntentRetry()
    {
        return RetryOptions.DEFAULT;
    }

    default long maxClockOffsetMillis()
    {
        return 250;
    }

    default String defaultUser()
    {
        return "root";
    }

    default int defaultUserPriority()
    {
        return 1;
    }

    default IsolationLevel defaultIsolation()
    {
        return IsolationLevel.SERIALIZABLE;
    }
}
