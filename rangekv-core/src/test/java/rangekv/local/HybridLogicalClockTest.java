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

import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import rangekv.primitives.Timestamp;

import static org.assertj.core.api.Assertions.assertThat;

class HybridLogicalClockTest
{
    @Test
    void logicalTicksWithinMillisecond()
    {
        AtomicLong physical = new AtomicLong(100);
        HybridLogicalClock clock = new HybridLogicalClock(physical::get, 250);
        assertThat(clock.now()).isEqualTo(Timestamp.of(100, 0));
        assertThat(clock.now()).isEqualTo(Timestamp.of(100, 1));
        physical.set(101);
        assertThat(clock.now()).isEqualTo(Timestamp.of(101, 0));
    }

    @Test
    void neverRunsBackwards()
    {
        AtomicLong physical = new AtomicLong(100);
        HybridLogicalClock clock = new HybridLogicalClock(physical::get, 250);
        Timestamp before = clock.now();
        physical.set(50);
        assertThat(clock.now()).isGreaterThan(before);
    }

    @Test
    void followsObservedTimestamps()
    {
        AtomicLong physical = new AtomicLong(100);
        HybridLogicalClock clock = new HybridLogicalClock(physical::get, 250);
        clock.now();
        assertThat(clock.update(Timestamp.of(200, 5))).isEqualTo(Timestamp.of(200, 6));
        assertThat(clock.now()).isEqualTo(Timestamp.of(200, 7));
        // an older observation still ticks
        assertThat(clock.update(Timestamp.of(10, 0))).isEqualTo(Timestamp.of(200, 8));
        physical.set(300);
        assertThat(clock.update(Timestamp.of(250, 0))).isEqualTo(Timestamp.of(300, 0));
    }
}
