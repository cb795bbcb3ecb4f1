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

class KeyTest
{
    @Test
    void unsignedOrdering()
    {
        Key low = Key.of(new byte[] { 0x7f });
        Key high = Key.of(new byte[] { (byte) 0x80 });
        assertThat(low).isLessThan(high);
        assertThat(Key.MIN).isLessThan(Key.of("a"));
        assertThat(Key.of("zzzz")).isLessThan(Key.MAX);
        assertThat(Key.of("a")).isLessThan(Key.of("a").next());
        assertThat(Key.of("a").next()).isLessThan(Key.of("b"));
    }

    @Test
    void prefixes()
    {
        Key prefix = Key.of("pre");
        Key key = Key.make(prefix, Key.of("fix"));
        assertThat(key).isEqualTo(Key.of("prefix"));
        assertThat(key.startsWith(prefix)).isTrue();
        assertThat(prefix.startsWith(key)).isFalse();
        assertThat(key.stripPrefix(prefix)).isEqualTo(Key.of("fix"));
        assertThatThrownBy(() -> prefix.stripPrefix(key)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void immutable()
    {
        byte[] bytes = { 1, 2, 3 };
        Key key = Key.of(bytes);
        bytes[0] = 9;
        key.toByteArray()[1] = 9;
        assertThat(key.toByteArray()).containsExactly(1, 2, 3);
    }

    @Test
    void printable()
    {
        assertThat(Key.of(new byte[] { 0, 'a', (byte) 0xff }).toString()).isEqualTo("\"\\x00a\\xff\"");
    }
}
