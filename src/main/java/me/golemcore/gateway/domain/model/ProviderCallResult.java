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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Outcome of one provider call, live or fallback. Consumed immediately by the
 * quota debit and the usage recorder; never persisted as-is.
 */
@Data
@Builder
public class ProviderCallResult {

    private String text;
    private int tokens;
    private double cost;
    private String model;
    private ProviderType provider;
    private Duration latency;

    // Set when the deterministic fallback produced the result
    private boolean fallback;
}
