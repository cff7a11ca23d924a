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
import me.golemcore.gateway.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.gateway.adapter.inbound.web.security.ApiKeyResolver;
import me.golemcore.gateway.domain.model.CompletionRequest;
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.domain.service.MeteringService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Metered chat completion endpoint.
 *
 * <p>
 * Admission touches the account store, so the call is moved off the event
 * loop. Cancelling the response subscription (client disconnect) cancels the
 * pending completion.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private static final String ENDPOINT = "/api/chat";

    private final MeteringService meteringService;
    private final ApiKeyResolver apiKeyResolver;

    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody(required = false) ChatRequest request,
            ServerWebExchange exchange) {
        String credential = apiKeyResolver.resolve(exchange.getRequest());
        return Mono.defer(() -> Mono.fromFuture(meteringService.complete(credential, toCompletionRequest(request))))
                .subscribeOn(Schedulers.boundedElastic())
                .map(completion -> ResponseEntity.ok(ChatResponse.from(completion)));
    }

    private static CompletionRequest toCompletionRequest(ChatRequest request) {
        ChatRequest body = request != null ? request : new ChatRequest();
        return CompletionRequest.builder()
                .prompt(body.getPrompt())
                .model(body.getModel() != null ? body.getModel() : "auto")
                .provider(ProviderType.fromId(body.getProvider()))
                .endpoint(ENDPOINT)
                .build();
    }
}
