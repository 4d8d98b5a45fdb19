/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.telemetry.api;

/**
 * Receives alerts, limit events or status changes from a monitor. Handlers are invoked synchronously on the thread
 * which triggered the event and are expected to be cheap, i.e. do all non-trivial work (sending network messages,
 * etc) asynchronously. An exception thrown by one handler never prevents delivery to the others.
 */
@FunctionalInterface
public interface AlertHandler<T> {
    void handle(T event);
}
