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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the admin endpoints with the shared {@code gateway.admin.token}. The
 * admin API is disabled while no token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminTokenVerifier {

    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final GatewayProperties properties;

    /**
     * @throws ResponseStatusException
     *             403 when the admin API is disabled, 401 for a missing or wrong
     *             token
     */
    public void verify(HttpHeaders headers) {
        String expected = properties.getAdmin().getToken();
        if (expected == null || expected.isBlank()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Admin API is disabled");
        }
        String provided = headers.getFirst(ADMIN_TOKEN_HEADER);
        if (provided == null || !constantTimeEquals(expected, provided)) {
            log.warn("[API] Rejected admin request with missing or invalid token");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid admin token");
        }
    }

    private boolean constantTimeEquals(String expected, String provided) {
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }
}
