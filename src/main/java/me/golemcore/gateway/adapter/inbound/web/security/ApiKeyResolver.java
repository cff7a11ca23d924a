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
package me.golemcore.gateway.adapter.inbound.web.security;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

/**
 * Extracts the caller's API key from a request.
 *
 * <p>
 * Lookup order: {@code X-API-Key} header, {@code Authorization: Bearer <key>},
 * then the {@code api_key} query parameter. Returns {@code null} when none is
 * present; validation is left to the admission pipeline.
 */
@Component
public class ApiKeyResolver {

    static final String API_KEY_HEADER = "X-API-Key";
    static final String API_KEY_PARAM = "api_key";
    private static final String BEARER_PREFIX = "Bearer ";

    public String resolve(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();

        String headerKey = headers.getFirst(API_KEY_HEADER);
        if (headerKey != null && !headerKey.isBlank()) {
            return headerKey.trim();
        }

        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return authHeader.substring(BEARER_PREFIX.length()).trim();
        }

        String queryKey = request.getQueryParams().getFirst(API_KEY_PARAM);
        if (queryKey != null && !queryKey.isBlank()) {
            return queryKey.trim();
        }
        return null;
    }
}
