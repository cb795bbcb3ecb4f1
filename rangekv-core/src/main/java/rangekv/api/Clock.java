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

import rangekv.primitives.Timestamp;

/**
 * Source of hybrid logical timestamps for stamping transactions, requests and idempotency tokens
 */
public interface Clock
{
    /**
     * @return a timestamp strictly greater than any previously returned or observed by this clock
     */
    Timestamp now();

    /**
     * Fold a timestamp received from elsewhere into the clock, so that subsequent {@link #now()} calls follow it.
     * @return the clock's new latest timestamp
     */
    Timestamp update(Timestamp observed);

    /**
     * The maximum tolerated offset between the clocks of any two nodes
     */
    long maxOffsetMillis();
}
