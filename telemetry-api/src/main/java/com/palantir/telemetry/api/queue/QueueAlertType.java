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

package com.palantir.telemetry.api.queue;

public enum QueueAlertType {
    /** More jobs are waiting than the configured depth threshold. */
    DEPTH_EXCEEDED,
    /** The share of failed jobs exceeds the configured failure-rate threshold. */
    HIGH_FAILURE_RATE,
    /** The oldest waiting job is older than the configured staleness threshold. */
    STALE_JOBS,
    /** Average processing time of recent jobs exceeds the configured threshold. */
    PROCESSING_SLOW
}
