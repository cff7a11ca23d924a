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
package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.ProviderCallResult;
import me.golemcore.gateway.domain.model.ProviderType;

import java.util.concurrent.CompletableFuture;

/**
 * One upstream text-generation provider.
 *
 * <p>
 * {@link #complete} never completes exceptionally because of upstream trouble:
 * missing credentials, transport or API errors and timeouts all resolve to the
 * deterministic {@link #fallback} result. Cancelling the returned future
 * abandons the call.
 */
public interface ProviderPort {

    ProviderType getProviderType();

    String getDefaultModel();

    /**
     * Whether a live upstream client is configured. Unconfigured providers always
     * answer with the fallback.
     */
    boolean isConfigured();

    CompletableFuture<ProviderCallResult> complete(String model, String prompt);

    /**
     * Deterministic simulated result for the given model and prompt.
     */
    ProviderCallResult fallback(String model, String prompt);
}
