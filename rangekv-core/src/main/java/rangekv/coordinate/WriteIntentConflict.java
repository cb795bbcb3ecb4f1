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

import rangekv.primitives.Key;
import rangekv.primitives.Txn;

/**
 * An operation met another transaction's uncommitted write. If the conflict was {@link #resolved} the blocking
 * intent has already been cleared and the operation may be retried at once; otherwise the conflicting
 * transaction won the push and the operation must back off.
 */
public class WriteIntentConflict extends KeyValueFailure
{
    public final Key key;
    public final Txn conflicting;
    public final boolean resolved;

    public WriteIntentConflict(Key key, Txn conflicting, boolean resolved)
    {
        super(null, "Conflicting " + (resolved ? "resolved" : "unresolved") + " intent on " + key + " of " + conflicting);
        this.key = key;
        this.conflicting = conflicting;
        this.resolved = resolved;
    }
}
