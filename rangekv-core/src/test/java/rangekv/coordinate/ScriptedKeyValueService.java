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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

import rangekv.api.KeyValueService;
import rangekv.messages.EndTransaction;
import rangekv.messages.EndTransaction.EndTransactionReply;
import rangekv.messages.Get;
import rangekv.messages.Reply;
import rangekv.messages.Request;
import rangekv.utils.async.AsyncResult;
import rangekv.utils.async.AsyncResults;

/**
 * Answers requests from a script of responses, falling back to an empty success at the request's timestamp
 */
class ScriptedKeyValueService implements KeyValueService
{
    interface Response
    {
        AsyncResult<? extends Reply> respond(Request<?> request);
    }

    private final List<Request<?>> requests = new ArrayList<>();
    private final Deque<Response> script = new ArrayDeque<>();

    synchronized ScriptedKeyValueService then(Response response)
    {
        script.add(response);
        return this;
    }

    ScriptedKeyValueService thenFail(Function<Request<?>, Throwable> failure)
    {
        return then(request -> AsyncResults.failure(failure.apply(request)));
    }

    ScriptedKeyValueService thenReply(Function<Request<?>, Reply> reply)
    {
        return then(request -> AsyncResults.success(reply.apply(request)));
    }

    synchronized List<Request<?>> requests()
    {
        return new ArrayList<>(requests);
    }

    synchronized Request<?> request(int i)
    {
        return requests.get(i);
    }

    @Override
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public <R extends Reply> AsyncResult<R> send(Request<R> request)
    {
        Response response;
        synchronized (this)
        {
            requests.add(request);
            response = script.poll();
        }
        AsyncResult<? extends Reply> result = response == null ? AsyncResults.success(defaultReply(request))
                                                               : response.respond(request);
        return (AsyncResult<R>) (AsyncResult) result;
    }

    static Reply defaultReply(Request<?> request)
    {
        if (request instanceof EndTransaction)
            return new EndTransactionReply(request.timestamp(), request.txn());
        if (request instanceof Get)
            return new Get.GetReply(request.timestamp(), null);
        return new Reply(request.timestamp());
    }
}
