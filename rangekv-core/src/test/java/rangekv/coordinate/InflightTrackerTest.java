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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InflightTrackerTest
{
    @Test
    void runsWaitersOnceDrained()
    {
        InflightTracker tracker = new InflightTracker();
        List<String> ran = new ArrayList<>();

        tracker.whenDrained(() -> ran.add("idle"));
        assertThat(ran).containsExactly("idle");

        tracker.begin();
        tracker.begin();
        tracker.whenDrained(() -> ran.add("drained"));
        tracker.end();
        assertThat(ran).containsExactly("idle");
        tracker.end();
        assertThat(ran).containsExactly("idle", "drained");
        assertThat(tracker.inflight()).isZero();

        // waiters run only once
        tracker.begin();
        tracker.end();
        assertThat(ran).hasSize(2);
    }

    @Test
    void unbalancedEnd()
    {
        assertThatThrownBy(() -> new InflightTracker().end()).isInstanceOf(IllegalStateException.class);
    }
}
