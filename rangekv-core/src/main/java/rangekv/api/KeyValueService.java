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

package rangekv.api;

import rangekv.messages.Reply;
import rangekv.messages.Request;
import rangekv.utils.async.AsyncResult;

/**
 * The range-addressed key-value service: routes each request to the range that owns its key and completes
 * the returned result with the typed reply, or with a {@link rangekv.coordinate.KeyValueFailure}.
 *
 * Implementations must be safe for concurrent use.
 */
public interface KeyValueService
{
    <R extends Reply> AsyncResult<R> send(Request<R> request);
}
