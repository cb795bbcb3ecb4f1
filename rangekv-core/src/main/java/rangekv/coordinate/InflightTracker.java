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

import static rangekv.utils.Invariants.checkState;

/**
 * Counts the operations of a session that have been dispatched but not yet completed
 */
class InflightTracker
{
    private int inflight;
    private List<Runnable> waiting;

    synchronized void begin()
    {
        ++inflight;
    }

    void end()
    {
        List<Runnable> run;
        synchronized (this)
        {
            checkState(inflight > 0, "No operations in flight");
            if (--inflight > 0 || waiting == null)
                return;
            run = waiting;
            waiting = null;
        }
        run.forEach(Runnable::run);
    }

    /**
     * Run {@code onDrained} once no operations are in flight, immediately if there are none now
     */
    void whenDrained(Runnable onDrained)
    {
        synchronized (this)
        {
            if (inflight > 0)
            {
                if (waiting == null)
                    waiting = new ArrayList<>();
                waiting.add(onDrained);
                return;
            }
        }
        onDrained.run();
    }

    synchronized int inflight()
    {
        return inflight;
    }
}
