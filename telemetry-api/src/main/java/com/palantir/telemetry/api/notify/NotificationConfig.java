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

package com.palantir.telemetry.api.notify;

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.palantir.logsafe.SafeArg;
import java.util.Map;
import org.immutables.value.Value;

/** Routing and throttling of outbound chat notifications. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE, get = {"get*", "is*"})
@JsonDeserialize(as = ImmutableNotificationConfig.class)
public abstract class NotificationConfig {

    public static final String DEFAULT_CHANNEL = "#general";
    public static final int DEFAULT_RATE_LIMIT_PER_MINUTE = 30;

    @Value.Default
    public boolean isEnabled() {
        return true;
    }

    @Value.Default
    public String getDefaultChannel() {
        return DEFAULT_CHANNEL;
    }

    /** Category to channel overrides; categories without an entry go to {@link #getDefaultChannel()}. */
    public abstract Map<String, String> getChannelRouting();

    @Value.Default
    public int getRateLimitPerMinute() {
        return DEFAULT_RATE_LIMIT_PER_MINUTE;
    }

    public final String channelFor(String category) {
        return getChannelRouting().getOrDefault(category, getDefaultChannel());
    }

    @Value.Check
    protected final void check() {
        checkArgument(!getDefaultChannel().isEmpty(), "defaultChannel must be non-empty");
        checkArgument(
                getRateLimitPerMinute() > 0,
                "rateLimitPerMinute must be positive",
                SafeArg.of("rateLimitPerMinute", getRateLimitPerMinute()));
    }

    public static NotificationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableNotificationConfig.Builder {}
}
