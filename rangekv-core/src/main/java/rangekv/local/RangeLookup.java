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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangekv.api.KeyValueService;
import rangekv.messages.Scan;
import rangekv.primitives.Key;
import rangekv.primitives.KeyValue;
import rangekv.primitives.RangeDescriptor;
import rangekv.utils.async.AsyncResult;
import rangekv.utils.async.AsyncResults;

import static rangekv.local.MetaKeys.META2_PREFIX;
import static rangekv.local.MetaKeys.META_MAX;
import static rangekv.local.MetaKeys.isMeta2;
import static rangekv.local.MetaKeys.rangeMetaKey;

/**
 * Resolves the range owning a key by reading the addressing index. Since entries are keyed by the (exclusive)
 * end key of their range, the owner is described by the first entry after the key's {@link MetaKeys#rangeMetaKey}.
 */
public class RangeLookup
{
    private static final Logger logger = LoggerFactory.getLogger(RangeLookup.class);

    private RangeLookup() {}

    public static AsyncResult<RangeDescriptor> lookup(KeyValueService service, Key key)
    {
        Key metaKey = rangeMetaKey(key);
        // user keys are addressed by level-2 entries, everything else by level-1 entries
        Key end = isMeta2(metaKey) ? META_MAX : META2_PREFIX;
        Key start = metaKey.next();

        AsyncResult.Settable<RangeDescriptor> result = AsyncResults.settable();
        service.send(new Scan(start, end, 1)).addCallback((reply, failure) -> {
            if (failure != null)
            {
                result.setFailure(failure);
                return;
            }
            if (reply.rows.isEmpty())
            {
                result.setFailure(new RangeNotFound(key, "no addressing entry after " + metaKey));
                return;
            }
            KeyValue entry = reply.rows.get(0);
            RangeDescriptor descriptor = RangeDescriptor.deserialize(entry.value());
            logger.trace("{} addressed by {} to {}", key, entry.key, descriptor);
            result.setSuccess(descriptor);
        });
        return result;
    }
}
