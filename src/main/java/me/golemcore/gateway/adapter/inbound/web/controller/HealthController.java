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
package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.HealthResponse;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ObjectProvider<BuildProperties> buildPropertiesProvider;
    private final Environment environment;
    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String[] profiles = environment.getActiveProfiles();
        HealthResponse response = HealthResponse.builder()
                .status("healthy")
                .timestamp(clock.instant())
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .environment(profiles.length > 0 ? profiles[0] : "default")
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/ping")
    public Mono<String> ping() {
        return Mono.just("pong");
    }
}
