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

package rangekv.local;

import rangekv.coordinate.KeyValueFailure;
import rangekv.primitives.RangeDescriptor;

/**
 * Thrown for a range boundary inside the level-1 addressing space, which must always belong to a single range
 */
public class Meta1SplitRejected extends KeyValueFailure
{
    public final RangeDescriptor descriptor;

    public Meta1SplitRejected(RangeDescriptor descriptor)
    {
        super(null, "Cannot place a range boundary within the level-1 addressing keys: " + descriptor);
        this.descriptor = descriptor;
    }
}
