/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.gateway.domain.model;

import java.util.Locale;

/**
 * Upstream provider identity as requested by callers. {@link #AUTO} lets the
 * router infer the provider from the model name.
 */
public enum ProviderType {

    OPENAI("openai"), ANTHROPIC("anthropic"), AUTO("auto");

    private final String id;

    ProviderType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Parses a caller-supplied provider name. Blank values mean {@link #AUTO}.
     *
     * @throws IllegalArgumentException
     *             for unknown provider names
     */
    public static ProviderType fromId(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
