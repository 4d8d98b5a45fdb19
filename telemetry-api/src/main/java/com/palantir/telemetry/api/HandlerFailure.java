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

import java.time.Instant;
import org.immutables.value.Value;

/** Records that a registered handler threw while an event was being dispatched to it. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class HandlerFailure {

    /** Name of the dispatcher (usually the owning monitor) which invoked the handler. */
    @Value.Parameter
    public abstract String getSource();

    /** Name under which the failing handler was registered. */
    @Value.Parameter
    public abstract String getHandlerName();

    @Value.Parameter
    public abstract Throwable getError();

    @Value.Parameter
    public abstract Instant getTimestamp();

    public static HandlerFailure of(String source, String handlerName, Throwable error, Instant timestamp) {
        return ImmutableHandlerFailure.of(source, handlerName, error, timestamp);
    }
}
