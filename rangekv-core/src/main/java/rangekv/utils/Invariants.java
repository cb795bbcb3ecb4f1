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

package rangekv.utils;

import javax.annotation.Nullable;

public class Invariants
{
    private Invariants() {}

    public static IllegalStateException illegalState(String msg)
    {
        return new IllegalStateException(msg);
    }

    public static IllegalArgumentException illegalArgument(String msg)
    {
        return new IllegalArgumentException(msg);
    }

    public static void checkState(boolean condition)
    {
        if (!condition)
            throw new IllegalStateException();
    }

    public static void checkState(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalStateException(msg);
    }

    public static void checkState(boolean condition, String fmt, @Nullable Object arg)
    {
        if (!condition)
            throw new IllegalStateException(String.format(fmt, arg));
    }

    public static <T> T nonNull(T param)
    {
        if (param == null)
            throw new NullPointerException();
        return param;
    }

    public static <T> T nonNull(T param, String msg)
    {
        if (param == null)
            throw new NullPointerException(msg);
        return param;
    }

    public static int isNatural(int input)
    {
        if (input < 0)
            throw new IllegalArgumentException();
        return input;
    }

    public static long isNatural(long input)
    {
        if (input < 0)
            throw new IllegalArgumentException();
        return input;
    }

    public static void checkArgument(boolean condition)
    {
        if (!condition)
            throw new IllegalArgumentException();
    }

    public static void checkArgument(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
    }

    public static void checkArgument(boolean condition, String fmt, @Nullable Object arg)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, arg));
    }

    public static void checkArgument(boolean condition, String fmt, @Nullable Object arg1, @Nullable Object arg2)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, arg1, arg2));
    }

    public static <T> T checkArgument(T param, boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
        return param;
    }
}
