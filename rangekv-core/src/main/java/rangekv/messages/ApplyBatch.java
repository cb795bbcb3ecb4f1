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

package rangekv.messages;

import java.util.List;

import com.google.common.collect.ImmutableList;

import rangekv.primitives.Batch;
import rangekv.primitives.Mutation;

import static rangekv.utils.Invariants.checkArgument;

/**
 * Applies a list of puts and deletes as one unit: either all of them take effect, or none do.
 */
public class ApplyBatch extends Request<Reply>
{
    public final ImmutableList<Mutation> mutations;

    public ApplyBatch(Batch batch)
    {
        this(batch.mutations());
    }

    public ApplyBatch(List<Mutation> mutations)
    {
        this(RequestHeader.of(checkArgument(mutations, !mutations.isEmpty(), "empty batch").get(0).key), ImmutableList.copyOf(mutations));
    }

    private ApplyBatch(RequestHeader header, ImmutableList<Mutation> mutations)
    {
        super(header);
        this.mutations = mutations;
    }

    @Override
    public Method method()
    {
        return Method.BATCH;
    }

    @Override
    public ApplyBatch withHeader(RequestHeader header)
    {
        return new ApplyBatch(header, mutations);
    }
}
