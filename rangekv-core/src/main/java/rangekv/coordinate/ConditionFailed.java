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

import com.google.common.io.BaseEncoding;

import rangekv.primitives.Key;
import rangekv.primitives.Timestamp;

public class ConditionFailed extends KeyValueFailure
{
    public final Key key;
    private final @Nullable byte[] actual;

    public ConditionFailed(Key key, @Nullable byte[] actual, Timestamp timestamp)
    {
        super(timestamp, "Unexpected value at " + key + ": " + (actual == null ? "<none>" : BaseEncoding.base16().encode(actual)));
        this.key = key;
        this.actual = actual == null ? null : actual.clone();
    }

    public @Nullable byte[] actual()
    {
        return actual == null ? null : actual.clone();
    }
}
