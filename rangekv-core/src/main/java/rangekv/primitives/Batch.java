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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Collects puts and deletes to be applied as one unit, in the order they were added
 */
public class Batch
{
    private final List<Mutation> mutations = new ArrayList<>();

    public Batch put(Key key, byte[] value)
    {
        mutations.add(Mutation.put(key, value));
        return this;
    }

    public Batch delete(Key key)
    {
        mutations.add(Mutation.delete(key));
        return this;
    }

    public ImmutableList<Mutation> mutations()
    {
        return ImmutableList.copyOf(mutations);
    }

    public boolean isEmpty()
    {
        return mutations.isEmpty();
    }

    public int size()
    {
        return mutations.size();
    }

    @Override
    public String toString()
    {
        return mutations.toString();
    }
}
