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

package rangekv.messages;

/**
 * The operations understood by a {@link rangekv.api.KeyValueService}, tagged by whether they mutate data
 * and whether they may run as part of a transaction.
 */
public enum Method
{
    GET              (true,  true),
    SCAN             (true,  true),
    PUT              (false, true),
    CONDITIONAL_PUT  (false, true),
    INCREMENT        (false, true),
    DELETE           (false, true),
    DELETE_RANGE     (false, true),
    BATCH            (false, true),
    // issued by the coordinator itself, never through a transactional session
    END_TRANSACTION  (false, false),
    ADMIN_SPLIT      (false, false),
    ADMIN_MERGE      (false, false);

    private final boolean readOnly;
    private final boolean transactional;

    Method(boolean readOnly, boolean transactional)
    {
        this.readOnly = readOnly;
        this.transactional = transactional;
    }

    public boolean isReadOnly()
    {
        return readOnly;
    }

    public boolean isTransactional()
    {
        return transactional;
    }
}
