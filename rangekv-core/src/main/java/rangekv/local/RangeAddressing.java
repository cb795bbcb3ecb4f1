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

import rangekv.primitives.Batch;
import rangekv.primitives.Key;
import rangekv.primitives.RangeDescriptor;

import static rangekv.local.MetaKeys.META1_KEY_MAX;
import static rangekv.local.MetaKeys.isMeta1;
import static rangekv.local.MetaKeys.isMeta2;
import static rangekv.local.MetaKeys.rangeMetaKey;
import static rangekv.utils.Invariants.checkArgument;

/**
 * Maintains the addressing index entries of range descriptors as ranges are split and merged. The entries are
 * appended to a caller supplied {@link Batch} which must be applied atomically; nothing is appended if the
 * change is rejected.
 *
 * A descriptor is addressed by:
 * <ul>
 *     <li>an entry at {@code rangeMetaKey(end)}: a level-1 entry if it ends within the level-2 keys,
 *     otherwise a level-2 entry</li>
 *     <li>additionally, {@link MetaKeys#META1_KEY_MAX} if it ends outside the level-2 keys but starts
 *     at {@link Key#MIN} or within them, since it then holds the last level-2 entries</li>
 * </ul>
 */
public class RangeAddressing
{
    private RangeAddressing() {}

    public static void onSplit(Batch batch, RangeDescriptor original, RangeDescriptor left, RangeDescriptor right)
    {
        checkArgument(left.startKey.equals(original.startKey), "left %s does not start at %s", left, original);
        checkArgument(left.endKey.equals(right.startKey), "left %s does not abut right %s", left, right);
        checkArgument(right.endKey.equals(original.endKey), "right %s does not end at %s", right, original);

        List<Key> leftKeys = addressingKeys(left);
        List<Key> rightKeys = addressingKeys(right);
        put(batch, leftKeys, left);
        put(batch, rightKeys, right);
    }

    public static void onMerge(Batch batch, RangeDescriptor left, RangeDescriptor right, RangeDescriptor merged)
    {
        checkArgument(left.endKey.equals(right.startKey), "left %s does not abut right %s", left, right);
        checkArgument(merged.startKey.equals(left.startKey) && merged.endKey.equals(right.endKey),
                      "%s does not cover %s", merged, left + " and " + right);

        List<Key> leftKeys = addressingKeys(left);
        List<Key> mergedKeys = addressingKeys(merged);
        for (Key key : leftKeys)
            batch.delete(key);
        put(batch, mergedKeys, merged);
    }

    /**
     * (Over)write the addressing of a single descriptor
     */
    public static void update(Batch batch, RangeDescriptor descriptor)
    {
        put(batch, addressingKeys(descriptor), descriptor);
    }

    private static void put(Batch batch, List<Key> keys, RangeDescriptor descriptor)
    {
        byte[] value = descriptor.serialize();
        for (Key key : keys)
            batch.put(key, value);
    }

    static List<Key> addressingKeys(RangeDescriptor descriptor)
    {
        if (isMeta1(descriptor.startKey) || isMeta1(descriptor.endKey))
            throw new Meta1SplitRejected(descriptor);

        List<Key> keys = new ArrayList<>(2);
        keys.add(rangeMetaKey(descriptor.endKey));
        if (!isMeta2(descriptor.endKey) && (descriptor.startKey.isEmpty() || isMeta2(descriptor.startKey)))
            keys.add(META1_KEY_MAX);
        return keys;
    }
}
