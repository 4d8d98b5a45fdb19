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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** A custom audience: an ordered rule set which advertising platforms materialise into member lists. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class AudienceDefinition {

    public abstract String getId();

    public abstract String getName();

    public abstract Optional<String> getDescription();

    public abstract List<AudienceRule> getRules();

    public abstract Instant getCreatedAt();

    public abstract Optional<Instant> getUpdatedAt();

    @Value.Check
    protected final void check() {
        checkArgument(!getId().isEmpty(), "audience id must be non-empty");
        checkArgument(!getName().isEmpty(), "audience name must be non-empty");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableAudienceDefinition.Builder {}
}
