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

import java.util.List;
import org.immutables.value.Value;

/** Outcome of delivering one event to every registered handler. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class DispatchReport {

    private static final DispatchReport NONE =
            builder().handlerCount(0).build();

    /** Number of handlers the event was offered to. */
    public abstract int getHandlerCount();

    public abstract List<HandlerFailure> getFailures();

    @Value.Derived
    public int getDeliveredCount() {
        return getHandlerCount() - getFailures().size();
    }

    /** True iff every handler accepted the event without throwing. */
    public final boolean isClean() {
        return getFailures().isEmpty();
    }

    /** A report for an event that was not dispatched at all. */
    public static DispatchReport none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableDispatchReport.Builder {}
}
