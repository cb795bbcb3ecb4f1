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

import rangekv.primitives.Key;

/**
 * The reserved layout of the two-level range addressing index. Level-1 entries live under {@link #META1_PREFIX}
 * and address the ranges holding level-2 entries; level-2 entries live under {@link #META2_PREFIX} and address
 * the ranges holding user data. Each entry is keyed by the end key of the range it describes.
 */
public class MetaKeys
{
    public static final Key META_PREFIX = Key.of("\u0000\u0000meta");
    public static final Key META1_PREFIX = Key.of("\u0000\u0000meta1");
    public static final Key META2_PREFIX = Key.of("\u0000\u0000meta2");
    public static final Key META_MAX = Key.of("\u0000\u0000meta3");

    public static final Key META1_KEY_MAX = meta1Key(Key.MAX);

    private MetaKeys() {}

    public static Key meta1Key(Key key)
    {
        return Key.make(META1_PREFIX, key);
    }

    public static Key meta2Key(Key key)
    {
        return Key.make(META2_PREFIX, key);
    }

    public static boolean isMeta1(Key key)
    {
        return key.startsWith(META1_PREFIX);
    }

    public static boolean isMeta2(Key key)
    {
        return key.startsWith(META2_PREFIX);
    }

    /**
     * The key of the addressing entry one level up from {@code key}: a level-2 key for user data, a level-1 key
     * for a level-2 key, and {@link Key#MIN} for the empty key or a level-1 key. Any other key, including the
     * rest of the {@link #META_PREFIX} space such as {@link #META_MAX}, is addressed at level 2.
     */
    public static Key rangeMetaKey(Key key)
    {
        if (key.isEmpty() || isMeta1(key))
            return Key.MIN;
        if (isMeta2(key))
            return meta1Key(key.stripPrefix(META2_PREFIX));
        return meta2Key(key);
    }
}
