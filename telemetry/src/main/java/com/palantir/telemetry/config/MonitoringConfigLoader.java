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

package com.palantir.telemetry.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.telemetry.api.MonitoringConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link MonitoringConfig} from YAML or JSON. Omitted sections and fields take their defaults; invalid values
 * fail here, before any component is built.
 */
public final class MonitoringConfigLoader {

    private static final SafeLogger log = SafeLoggerFactory.get(MonitoringConfigLoader.class);

    // YAML is a superset of JSON, so one mapper reads both
    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .registerModule(new GuavaModule())
            .registerModule(new Jdk8Module());

    private MonitoringConfigLoader() {}

    public static MonitoringConfig load(Path file) throws IOException {
        Preconditions.checkNotNull(file, "file must not be null");
        try (InputStream stream = Files.newInputStream(file)) {
            MonitoringConfig config = read(stream);
            log.info("Loaded monitoring configuration", SafeArg.of("file", file.getFileName()));
            return config;
        }
    }

    public static MonitoringConfig read(InputStream stream) throws IOException {
        Preconditions.checkNotNull(stream, "stream must not be null");
        try {
            return orDefaults(mapper.readValue(stream, MonitoringConfig.class));
        } catch (JsonProcessingException e) {
            throw invalid(e);
        }
    }

    public static MonitoringConfig parse(String content) {
        Preconditions.checkNotNull(content, "content must not be null");
        if (content.isBlank()) {
            return MonitoringConfig.defaults();
        }
        try {
            return orDefaults(mapper.readValue(content, MonitoringConfig.class));
        } catch (JsonProcessingException e) {
            throw invalid(e);
        }
    }

    // a document holding only a separator or comments deserializes to null
    private static MonitoringConfig orDefaults(MonitoringConfig config) {
        return config == null ? MonitoringConfig.defaults() : config;
    }

    private static SafeIllegalArgumentException invalid(JsonProcessingException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SafeIllegalArgumentException) {
                return (SafeIllegalArgumentException) cause;
            }
            cause = cause.getCause();
        }
        return new SafeIllegalArgumentException(
                "Invalid monitoring configuration", e, UnsafeArg.of("reason", e.getOriginalMessage()));
    }
}
