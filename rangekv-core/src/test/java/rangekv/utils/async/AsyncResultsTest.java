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

package rangekv.utils.async;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsyncResultsTest
{
    @Test
    void notifiesListenersOnce()
    {
        AsyncResult.Settable<String> result = AsyncResults.settable();
        List<String> seen = new ArrayList<>();
        result.addCallback((success, failure) -> seen.add("before:" + success));
        assertThat(result.isDone()).isFalse();

        assertThat(result.trySuccess("a")).isTrue();
        assertThat(result.trySuccess("b")).isFalse();
        assertThatThrownBy(() -> result.setFailure(new RuntimeException())).isInstanceOf(IllegalStateException.class);
        result.addCallback((success, failure) -> seen.add("after:" + success));

        assertThat(seen).containsExactly("before:a", "after:a");
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void blockingGet() throws Exception
    {
        assertThat(AsyncResults.getBlocking(AsyncResults.success(1))).isEqualTo(1);
        RuntimeException failure = new IllegalStateException();
        assertThatThrownBy(() -> AsyncResults.getBlocking(AsyncResults.failure(failure)))
            .isInstanceOf(ExecutionException.class)
            .hasCause(failure);
        assertThatThrownBy(() -> AsyncResults.getUnchecked(AsyncResults.failure(failure))).isSameAs(failure);
        assertThatThrownBy(() -> AsyncResults.getBlocking(AsyncResults.settable(), 1, TimeUnit.MILLISECONDS))
            .isInstanceOf(TimeoutException.class);
    }
}
