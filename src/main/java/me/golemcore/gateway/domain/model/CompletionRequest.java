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

/**
 * One logical "generate text" request as accepted by the metering kernel.
 */
@Data
@Builder
public class CompletionRequest {

    private String prompt;
    @Builder.Default
    private String model = "auto";
    @Builder.Default
    private ProviderType provider = ProviderType.AUTO;
    @Builder.Default
    private String endpoint = "/api/chat";
}
