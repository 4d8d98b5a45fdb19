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

import org.immutables.value.Value;

/**
 * A single membership predicate, e.g. {@code country IN [US, CA]}. The value is opaque to the kernel and interpreted
 * by the platform adapters.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class AudienceRule {

    @Value.Parameter
    public abstract String getField();

    @Value.Parameter
    public abstract RuleOperator getOperator();

    @Value.Parameter
    public abstract Object getValue();

    public static AudienceRule of(String field, RuleOperator operator, Object value) {
        return ImmutableAudienceRule.of(field, operator, value);
    }
}
