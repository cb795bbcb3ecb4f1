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

/**
 * A transaction failed, and the abort that followed failed too. The original failure is the cause,
 * the abort's failure is suppressed.
 */
public class AbortFailed extends KeyValueFailure
{
    public AbortFailed(Throwable original, Throwable abortFailure)
    {
        super(null, "after error " + original.getMessage() + "; failed abort: " + abortFailure.getMessage(), original);
        addSuppressed(abortFailure);
    }

    public Throwable original()
    {
        return getCause();
    }

    public Throwable abortFailure()
    {
        return getSuppressed()[0];
    }
}
