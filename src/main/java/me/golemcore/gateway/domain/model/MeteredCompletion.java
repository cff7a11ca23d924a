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
 * Provider result enriched with the caller's quota position after the debit.
 */
@Data
@Builder
public class MeteredCompletion {

    private String requestId;
    private String text;
    private String model;
    private ProviderType provider;
    private int tokens;
    private double cost;
    private Duration latency;
    private long totalTokensUsed;
    private long remainingQuota;
    private double quotaPercentage;
}
