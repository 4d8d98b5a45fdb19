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

import java.util.concurrent.CompletableFuture;

/**
 * Pushes an audience to one external advertising platform. Implementations report platform-side failures through a
 * failed {@link SyncResult} or an exceptionally completed future; both are recorded as a failed sync.
 */
public interface PlatformSyncAdapter {

    /** Platform identifier, e.g. {@code meta} or {@code tiktok}. */
    String platform();

    CompletableFuture<SyncResult> sync(AudienceDefinition audience);
}
