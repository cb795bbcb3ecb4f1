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

import java.util.Arrays;

public final class KeyValue
{
    public final Key key;
    private final byte[] value;
    public final Timestamp timestamp;

    public KeyValue(Key key, byte[] value, Timestamp timestamp)
    {
        this.key = key;
        this.value = value;
        this.timestamp = timestamp;
    }

    public byte[] value()
    {
        return value.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof KeyValue)) return false;
        KeyValue that = (KeyValue) o;
        return key.equals(that.key) && Arrays.equals(value, that.value) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode()
    {
        return key.hashCode() * 31 + Arrays.hashCode(value);
    }

    @Override
    public String toString()
    {
        return key + "=" + Arrays.toString(value) + '@' + timestamp;
    }
}
