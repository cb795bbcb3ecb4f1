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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import rangekv.api.LocalConfig;
import rangekv.api.Scheduler;
import rangekv.client.DB;
import rangekv.impl.InMemoryKeyValueService;
import rangekv.primitives.Batch;
import rangekv.primitives.Key;
import rangekv.primitives.KeyValue;
import rangekv.primitives.RangeDescriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static rangekv.local.MetaKeys.META1_KEY_MAX;
import static rangekv.local.MetaKeys.META_MAX;
import static rangekv.local.MetaKeys.META_PREFIX;
import static rangekv.local.MetaKeys.meta1Key;
import static rangekv.local.MetaKeys.meta2Key;
import static rangekv.local.MetaKeys.rangeMetaKey;

class RangeAddressingTest
{
    enum Kind { BOOTSTRAP, SPLIT, MERGE }

    /**
     * For a split, {@code left} and {@code right} are the new ranges. For a merge, {@code left} is the range
     * being absorbed and {@code right} the merged result, and {@code leftKeys} are the entries expected to go.
     */
    static class Step
    {
        final Kind kind;
        final Key leftStart, leftEnd, rightStart, rightEnd;
        final Key[] leftKeys, rightKeys;

        Step(Kind kind, Key leftStart, Key leftEnd, Key rightStart, Key rightEnd, Key[] leftKeys, Key[] rightKeys)
        {
            this.kind = kind;
            this.leftStart = leftStart;
            this.leftEnd = leftEnd;
            this.rightStart = rightStart;
            this.rightEnd = rightEnd;
            this.leftKeys = leftKeys;
            this.rightKeys = rightKeys;
        }
    }

    private static final Key A = Key.of("a"), M = Key.of("m"), R = Key.of("r"), Z = Key.of("z");

    private static Key[] keys(Key ... keys)
    {
        return keys;
    }

    private static Step step(Kind kind, Key leftStart, Key leftEnd, Key rightStart, Key rightEnd, Key[] leftKeys, Key[] rightKeys)
    {
        return new Step(kind, leftStart, leftEnd, rightStart, rightEnd, leftKeys, rightKeys);
    }

    private static final List<Step> STEPS = List.of(
        step(Kind.BOOTSTRAP, Key.MIN, Key.MAX, Key.MIN, Key.MAX, keys(), keys(META1_KEY_MAX, meta2Key(Key.MAX))),
        // split [min, max) at a, then a-max at z, then a-z at m
        step(Kind.SPLIT, Key.MIN, A, A, Key.MAX, keys(META1_KEY_MAX, meta2Key(A)), keys(meta2Key(Key.MAX))),
        step(Kind.SPLIT, A, Z, Z, Key.MAX, keys(meta2Key(Z)), keys(meta2Key(Key.MAX))),
        step(Kind.SPLIT, A, M, M, Z, keys(meta2Key(M)), keys(meta2Key(Z))),
        // split the first range within the level-2 keys
        step(Kind.SPLIT, Key.MIN, meta2Key(M), meta2Key(M), A, keys(meta1Key(M)), keys(META1_KEY_MAX, meta2Key(A))),
        step(Kind.SPLIT, meta2Key(M), meta2Key(Z), meta2Key(Z), A, keys(meta1Key(Z)), keys(META1_KEY_MAX, meta2Key(A))),
        step(Kind.SPLIT, meta2Key(M), meta2Key(R), meta2Key(R), meta2Key(Z), keys(meta1Key(R)), keys(meta1Key(Z))),
        // and merge everything back
        step(Kind.MERGE, meta2Key(M), meta2Key(R), meta2Key(M), meta2Key(Z), keys(meta1Key(R)), keys(meta1Key(Z))),
        step(Kind.MERGE, meta2Key(M), meta2Key(Z), meta2Key(M), A, keys(meta1Key(Z)), keys(META1_KEY_MAX, meta2Key(A))),
        step(Kind.MERGE, Key.MIN, meta2Key(M), Key.MIN, A, keys(meta1Key(M)), keys(META1_KEY_MAX, meta2Key(A))),
        step(Kind.MERGE, A, M, A, Z, keys(meta2Key(M)), keys(meta2Key(Z))),
        step(Kind.MERGE, A, Z, A, Key.MAX, keys(meta2Key(Z)), keys(meta2Key(Key.MAX))),
        step(Kind.MERGE, Key.MIN, A, Key.MIN, Key.MAX, keys(meta2Key(A)), keys(META1_KEY_MAX, meta2Key(Key.MAX)))
    );

    private HybridLogicalClock clock;
    private InMemoryKeyValueService service;
    private DB db;

    @BeforeEach
    void setup()
    {
        clock = new HybridLogicalClock(0);
        service = new InMemoryKeyValueService(clock);
        db = new DB(service, clock, Scheduler.IMMEDIATE, LocalConfig.DEFAULT);
    }

    private Map<Key, RangeDescriptor> scanAddressing()
    {
        Map<Key, RangeDescriptor> result = new TreeMap<>();
        for (KeyValue kv : db.scan(META_PREFIX, META_MAX, 0))
            result.put(kv.key, RangeDescriptor.deserialize(kv.value()));
        return result;
    }

    @Test
    void splitsAndMerges()
    {
        Map<Key, RangeDescriptor> expect = new TreeMap<>();
        for (int i = 0 ; i < STEPS.size() ; ++i)
        {
            Step step = STEPS.get(i);
            RangeDescriptor left = new RangeDescriptor(i * 2, step.leftStart, step.leftEnd);
            RangeDescriptor right = new RangeDescriptor(i * 2 + 1, step.rightStart, step.rightEnd);
            Batch batch = new Batch();
            switch (step.kind)
            {
                case BOOTSTRAP:
                    RangeAddressing.update(batch, right);
                    break;
                case SPLIT:
                    RangeAddressing.onSplit(batch, new RangeDescriptor(-1, left.startKey, right.endKey), left, right);
                    for (Key key : step.leftKeys)
                        expect.put(key, left);
                    break;
                case MERGE:
                    RangeDescriptor absorbed = new RangeDescriptor(-1, left.endKey, right.endKey);
                    RangeAddressing.onMerge(batch, left, absorbed, right);
                    for (Key key : step.leftKeys)
                        expect.remove(key);
                    break;
            }
            for (Key key : step.rightKeys)
                expect.put(key, right);

            db.run(batch);
            assertThat(scanAddressing()).describedAs("step %d", i).isEqualTo(expect);
        }
    }

    @Test
    void splitAtUserKeyWritesOnlyLevelTwo()
    {
        RangeDescriptor original = new RangeDescriptor(1, Key.MIN, Key.MAX);
        RangeDescriptor left = new RangeDescriptor(1, Key.MIN, A);
        RangeDescriptor right = new RangeDescriptor(2, A, Key.MAX);
        Batch batch = new Batch();
        RangeAddressing.onSplit(batch, original, left, right);
        db.run(batch);

        Map<Key, RangeDescriptor> addressing = scanAddressing();
        assertThat(addressing).containsEntry(meta2Key(A), left)
                              .containsEntry(meta2Key(Key.MAX), right)
                              .containsEntry(META1_KEY_MAX, left)
                              .hasSize(3);
    }

    @Test
    void splitAtEndOfMetaSpaceWritesLevelTwo()
    {
        RangeDescriptor original = new RangeDescriptor(1, Key.MIN, Key.MAX);
        RangeDescriptor left = new RangeDescriptor(1, Key.MIN, META_MAX);
        RangeDescriptor right = new RangeDescriptor(2, META_MAX, Key.MAX);
        assertThat(RangeAddressing.addressingKeys(left)).containsExactly(meta2Key(META_MAX), META1_KEY_MAX);
        assertThat(RangeAddressing.addressingKeys(right)).containsExactly(meta2Key(Key.MAX));

        Batch batch = new Batch();
        RangeAddressing.onSplit(batch, original, left, right);
        db.run(batch);

        assertThat(scanAddressing()).containsEntry(meta2Key(META_MAX), left)
                                    .containsEntry(meta2Key(Key.MAX), right)
                                    .containsEntry(META1_KEY_MAX, left)
                                    .hasSize(3);
    }

    @Test
    void rejectsMeta1Split()
    {
        RangeDescriptor original = new RangeDescriptor(1, Key.MIN, Key.MAX);
        RangeDescriptor left = new RangeDescriptor(1, Key.MIN, meta1Key(A));
        RangeDescriptor right = new RangeDescriptor(2, meta1Key(A), Key.MAX);
        Batch batch = new Batch();
        assertThatThrownBy(() -> RangeAddressing.onSplit(batch, original, left, right))
            .isInstanceOf(Meta1SplitRejected.class);
        assertThat(batch.isEmpty()).isTrue();

        RangeDescriptor merged = new RangeDescriptor(1, Key.MIN, Key.MAX);
        assertThatThrownBy(() -> RangeAddressing.onMerge(batch, left, right, merged))
            .isInstanceOf(Meta1SplitRejected.class);
        assertThat(batch.isEmpty()).isTrue();
    }

    @Test
    void rejectsMismatchedDescriptors()
    {
        RangeDescriptor original = new RangeDescriptor(1, Key.MIN, Key.MAX);
        RangeDescriptor left = new RangeDescriptor(1, Key.MIN, A);
        RangeDescriptor right = new RangeDescriptor(2, M, Key.MAX);
        assertThatThrownBy(() -> RangeAddressing.onSplit(new Batch(), original, left, right))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RangeAddressing.onMerge(new Batch(), left, new RangeDescriptor(2, A, Key.MAX), new RangeDescriptor(1, Key.MIN, Z)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deterministic()
    {
        List<Batch> batches = new ArrayList<>();
        for (int i = 0 ; i < 2 ; ++i)
        {
            Batch split = new Batch();
            RangeAddressing.onSplit(split, new RangeDescriptor(1, Key.MIN, A),
                                    new RangeDescriptor(1, Key.MIN, meta2Key(M)), new RangeDescriptor(2, meta2Key(M), A));
            batches.add(split);
            Batch merge = new Batch();
            RangeAddressing.onMerge(merge, new RangeDescriptor(1, A, M), new RangeDescriptor(2, M, Z), new RangeDescriptor(1, A, Z));
            batches.add(merge);
        }
        assertThat(batches.get(0).mutations()).isEqualTo(batches.get(2).mutations());
        assertThat(batches.get(1).mutations()).isEqualTo(batches.get(3).mutations());
    }

    @Test
    void entriesFollowRangeMetaKey()
    {
        RangeDescriptor descriptor = new RangeDescriptor(3, meta2Key(M), meta2Key(Z));
        assertThat(RangeAddressing.addressingKeys(descriptor)).containsExactly(rangeMetaKey(meta2Key(Z)));
    }
}
