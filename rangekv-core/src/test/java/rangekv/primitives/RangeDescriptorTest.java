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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RangeDescriptorTest
{
    @Test
    void serialization()
    {
        RangeDescriptor descriptor = new RangeDescriptor(42, Key.MIN, Key.of(new byte[] { 0, (byte) 0xff, 7 }));
        assertThat(RangeDescriptor.deserialize(descriptor.serialize())).isEqualTo(descriptor);
    }

    @Test
    void rejectsEmptyRange()
    {
        assertThatThrownBy(() -> new RangeDescriptor(1, Key.of("b"), Key.of("a"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RangeDescriptor(1, Key.of("a"), Key.of("a"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void containsKey()
    {
        RangeDescriptor descriptor = new RangeDescriptor(1, Key.of("b"), Key.of("d"));
        assertThat(descriptor.containsKey(Key.of("a"))).isFalse();
        assertThat(descriptor.containsKey(Key.of("b"))).isTrue();
        assertThat(descriptor.containsKey(Key.of("c"))).isTrue();
        assertThat(descriptor.containsKey(Key.of("d"))).isFalse();
    }
}
