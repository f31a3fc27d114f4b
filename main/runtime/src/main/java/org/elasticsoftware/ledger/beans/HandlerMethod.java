/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */
package org.elasticsoftware.ledger.beans;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;

/**
 * A resolved handler method on an aggregate instance. Exceptions thrown by the handler body reach the
 * caller unchanged when they are unchecked, checked ones are wrapped in an {@link IllegalStateException}.
 */
final class HandlerMethod {
    private final Object target;
    private final Method method;
    private final MethodHandle handle;

    HandlerMethod(Object target, Method method) {
        this.target = target;
        this.method = method;
        try {
            this.handle = MethodHandles.lookup().unreflect(method).bindTo(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Handler " + describe() + " is not accessible", e);
        }
    }

    Object invoke(Object... arguments) {
        try {
            return handle.invokeWithArguments(arguments);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new IllegalStateException("Handler " + describe() + " failed", e);
        }
    }

    String describe() {
        return target.getClass().getSimpleName() + "." + method.getName();
    }
}
