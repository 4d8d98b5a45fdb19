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

package com.palantir.telemetry.api.audience;

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.palantir.logsafe.SafeArg;
import java.util.Optional;
import org.immutables.value.Value;

/** What a platform adapter reports back after pushing an audience. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE, get = {"get*", "is*"})
public abstract class SyncResult {

    @Value.Parameter
    public abstract long getMemberCount();

    @Value.Parameter
    public abstract boolean isSuccess();

    @Value.Parameter
    public abstract Optional<String> getError();

    @Value.Check
    protected final void check() {
        checkArgument(
                getMemberCount() >= 0,
                "memberCount must not be negative",
                SafeArg.of("memberCount", getMemberCount()));
    }

    public static SyncResult success(long memberCount) {
        return ImmutableSyncResult.of(memberCount, true, Optional.empty());
    }

    public static SyncResult failure(String error) {
        return ImmutableSyncResult.of(0, false, Optional.of(error));
    }
}
