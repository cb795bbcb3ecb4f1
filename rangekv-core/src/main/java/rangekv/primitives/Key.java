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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

import javax.annotation.Nonnull;

import com.google.common.primitives.UnsignedBytes;

import static rangekv.utils.Invariants.checkArgument;

/**
 * An immutable byte sequence, ordered by unsigned lexicographic comparison of its bytes.
 */
public final class Key implements Comparable<Key>
{
    private static final Comparator<byte[]> COMPARATOR = UnsignedBytes.lexicographicalComparator();

    public static final Key MIN = new Key(new byte[0]);
    public static final Key MAX = new Key(new byte[] { (byte) 0xff, (byte) 0xff });

    private final byte[] bytes;

    private Key(byte[] bytes)
    {
        this.bytes = bytes;
    }

    public static Key of(byte[] bytes)
    {
        return new Key(bytes.clone());
    }

    public static Key of(String key)
    {
        return new Key(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the concatenation of the supplied keys
     */
    public static Key make(Key prefix, Key suffix)
    {
        byte[] bytes = Arrays.copyOf(prefix.bytes, prefix.bytes.length + suffix.bytes.length);
        System.arraycopy(suffix.bytes, 0, bytes, prefix.bytes.length, suffix.bytes.length);
        return new Key(bytes);
    }

    public byte[] toByteArray()
    {
        return bytes.clone();
    }

    public int length()
    {
        return bytes.length;
    }

    public boolean isEmpty()
    {
        return bytes.length == 0;
    }

    public boolean startsWith(Key prefix)
    {
        if (prefix.bytes.length > bytes.length)
            return false;
        for (int i = 0 ; i < prefix.bytes.length ; ++i)
        {
            if (bytes[i] != prefix.bytes[i])
                return false;
        }
        return true;
    }

    /**
     * @return the remainder of this key after {@code prefix}, which it must start with
     */
    public Key stripPrefix(Key prefix)
    {
        checkArgument(startsWith(prefix), "%s does not start with %s", this, prefix);
        return new Key(Arrays.copyOfRange(bytes, prefix.bytes.length, bytes.length));
    }

    /**
     * @return the smallest key that sorts strictly after this one
     */
    public Key next()
    {
        return new Key(Arrays.copyOf(bytes, bytes.length + 1));
    }

    @Override
    public int compareTo(@Nonnull Key that)
    {
        return COMPARATOR.compare(this.bytes, that.bytes);
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof Key && Arrays.equals(bytes, ((Key) that).bytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(bytes);
    }

    public static Key max(Key a, Key b)
    {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Key min(Key a, Key b)
    {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Printable ASCII is rendered as-is, everything else as {@code \xNN}
     */
    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(bytes.length + 2).append('"');
        for (byte b : bytes)
        {
            int v = b & 0xff;
            if (v >= 0x20 && v < 0x7f && v != '"' && v != '\\') sb.append((char) v);
            else sb.append(String.format("\\x%02x", v));
        }
        return sb.append('"').toString();
    }
}
