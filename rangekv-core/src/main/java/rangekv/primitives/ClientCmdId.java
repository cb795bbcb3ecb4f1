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

package rangekv.primitives;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Idempotency token attached to mutating requests, so that a transport-level resend of the same request
 * is not applied twice by the service.
 */
public final class ClientCmdId
{
    public final long wallTime;
    public final long random;

    public ClientCmdId(long wallTime, long random)
    {
        this.wallTime = wallTime;
        this.random = random;
    }

    public static ClientCmdId next(Timestamp now)
    {
        return new ClientCmdId(now.wallTime, ThreadLocalRandom.current().nextLong(Long.MAX_VALUE));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ClientCmdId)) return false;
        ClientCmdId that = (ClientCmdId) o;
        return wallTime == that.wallTime && random == that.random;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(wallTime) * 31 + Long.hashCode(random);
    }

    @Override
    public String toString()
    {
        return wallTime + ":" + random;
    }
}
