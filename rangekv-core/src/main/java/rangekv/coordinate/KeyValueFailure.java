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

import rangekv.primitives.Timestamp;

/**
 * Base of every failure reported by a {@link rangekv.api.KeyValueService}. Where the service knows the
 * timestamp at which the failure was observed it is attached, so the coordinator can advance past it.
 */
public abstract class KeyValueFailure extends RuntimeException
{
    private final @Nullable Timestamp timestamp;

    protected KeyValueFailure(@Nullable Timestamp timestamp, String message)
    {
        super(message);
        this.timestamp = timestamp;
    }

    protected KeyValueFailure(@Nullable Timestamp timestamp, String message, Throwable cause)
    {
        super(message, cause);
        this.timestamp = timestamp;
    }

    public @Nullable Timestamp timestamp()
    {
        return timestamp;
    }
}
