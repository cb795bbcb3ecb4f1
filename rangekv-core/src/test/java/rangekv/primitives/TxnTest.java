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

import java.util.Random;

import org.junit.jupiter.api.Test;

import rangekv.local.HybridLogicalClock;

import static org.assertj.core.api.Assertions.assertThat;

class TxnTest
{
    @Test
    void exactPriority()
    {
        assertThat(Txn.makePriority(-5, new Random(0))).isEqualTo(5);
        assertThat(Txn.makePriority(Integer.MIN_VALUE, new Random(0))).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void randomPriorityBiasedByUserPriority()
    {
        Random random = new Random(1);
        for (int i = 0 ; i < 1000 ; ++i)
        {
            assertThat(Txn.makePriority(0, random)).isPositive();
            assertThat(Txn.makePriority(1, random)).isPositive();
            // user priority 100 confines the draw to the top hundredth of the space
            assertThat(Txn.makePriority(100, random)).isGreaterThan(Integer.MAX_VALUE - Integer.MAX_VALUE / 100);
        }
    }

    @Test
    void identityAnchoredAtKey()
    {
        HybridLogicalClock clock = new HybridLogicalClock(() -> 10, 0);
        Key anchor = Key.of("anchor");
        Txn a = Txn.create(anchor, 1, IsolationLevel.SERIALIZABLE, clock);
        Txn b = Txn.create(anchor, 1, IsolationLevel.SERIALIZABLE, clock);
        assertThat(a.key).isEqualTo(anchor);
        assertThat(a.id.startsWith(anchor)).isTrue();
        assertThat(a.isSameTxn(b)).isFalse();
        assertThat(a.epoch).isZero();
        assertThat(b.timestamp).isGreaterThan(a.timestamp);
    }

    @Test
    void restartsKeepIdentityAndMoveForward()
    {
        Txn txn = new Txn(Key.of("id"), Key.of("k"), 0, 10, IsolationLevel.SNAPSHOT, Timestamp.of(100, 0));
        Txn restarted = txn.nextEpoch(Timestamp.of(50, 0));
        assertThat(restarted.isSameTxn(txn)).isTrue();
        assertThat(restarted.epoch).isEqualTo(1);
        assertThat(restarted.timestamp).isEqualTo(Timestamp.of(100, 0));
        assertThat(txn.nextEpoch(Timestamp.of(200, 3)).timestamp).isEqualTo(Timestamp.of(200, 3));
    }

    @Test
    void priorityOnlyRises()
    {
        Txn txn = new Txn(Key.of("id"), Key.of("k"), 0, 10, IsolationLevel.SERIALIZABLE, Timestamp.of(1, 0));
        assertThat(txn.upgradePriority(5)).isSameAs(txn);
        assertThat(txn.upgradePriority(10)).isSameAs(txn);
        assertThat(txn.upgradePriority(11).priority).isEqualTo(11);
    }
}
