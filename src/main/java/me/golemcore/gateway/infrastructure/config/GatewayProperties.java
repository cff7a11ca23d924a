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

package me.golemcore.gateway.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All gateway configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link PlanProperties} - plan tiers with token quota, hourly request
 * limit and price</li>
 * <li>{@link ProviderProperties} - upstream providers (credentials, default
 * model, routing prefixes, rate table, fallback tuning)</li>
 * <li>{@link RouterProperties} - default route for unrecognized models</li>
 * <li>{@link UpstreamProperties} - upstream call timeout and output cap</li>
 * <li>{@link AccountingProperties} - retry policy for debits and usage
 * writes</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * </ul>
 *
 * <p>
 * Plan tiers are data: adding a {@code gateway.plans.<tier>.*} block makes the
 * tier available to quota and rate-limit decisions without code changes.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private int billingPeriodDays = 30;
    private int defaultRequestsPerHour = 100;
    private String upgradeUrl = "/billing";

    private Map<String, PlanProperties> plans = defaultPlans();
    private ProvidersProperties providers = new ProvidersProperties();
    private RouterProperties router = new RouterProperties();
    private UpstreamProperties upstream = new UpstreamProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private AccountingProperties accounting = new AccountingProperties();
    private UsageProperties usage = new UsageProperties();
    private StorageProperties storage = new StorageProperties();
    private DemoAccountProperties demoAccount = new DemoAccountProperties();
    private AdminProperties admin = new AdminProperties();

    // ==================== PLANS ====================

    @Data
    public static class PlanProperties {
        private long tokensPerPeriod;
        private int requestsPerHour;
        private double price;

        public static PlanProperties of(long tokensPerPeriod, int requestsPerHour, double price) {
            PlanProperties plan = new PlanProperties();
            plan.setTokensPerPeriod(tokensPerPeriod);
            plan.setRequestsPerHour(requestsPerHour);
            plan.setPrice(price);
            return plan;
        }
    }

    private static Map<String, PlanProperties> defaultPlans() {
        Map<String, PlanProperties> plans = new LinkedHashMap<>();
        plans.put("free", PlanProperties.of(10_000, 100, 0));
        plans.put("starter", PlanProperties.of(100_000, 1000, 9.99));
        plans.put("pro", PlanProperties.of(1_000_000, 5000, 49.99));
        plans.put("enterprise", PlanProperties.of(10_000_000, 20000, 199.99));
        return plans;
    }

    // ==================== PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private ProviderProperties openai = ProviderProperties.openAiDefaults();
        private ProviderProperties anthropic = ProviderProperties.anthropicDefaults();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private String defaultModel;
        private List<String> modelPrefixes = new ArrayList<>();
        private double fallbackTokenMultiplier = 1.0;
        private long fallbackLatencyMs = 500;
        private double defaultRate;
        private Map<String, Double> rates = new LinkedHashMap<>();

        static ProviderProperties openAiDefaults() {
            ProviderProperties openai = new ProviderProperties();
            openai.setDefaultModel("gpt-3.5-turbo");
            openai.setModelPrefixes(new ArrayList<>(List.of("gpt")));
            openai.setFallbackTokenMultiplier(1.3);
            openai.setFallbackLatencyMs(500);
            openai.setDefaultRate(0.000002);
            openai.getRates().put("gpt-4", 0.00003);
            openai.getRates().put("gpt-3.5-turbo", 0.000002);
            openai.getRates().put("gpt-4-turbo", 0.00001);
            return openai;
        }

        static ProviderProperties anthropicDefaults() {
            ProviderProperties anthropic = new ProviderProperties();
            anthropic.setDefaultModel("claude-3-sonnet-20240229");
            anthropic.setModelPrefixes(new ArrayList<>(List.of("claude")));
            anthropic.setFallbackTokenMultiplier(1.2);
            anthropic.setFallbackLatencyMs(700);
            anthropic.setDefaultRate(0.000015);
            anthropic.getRates().put("claude-3-sonnet-20240229", 0.000015);
            anthropic.getRates().put("claude-3-haiku-20240307", 0.000001);
            anthropic.getRates().put("claude-3-opus-20240229", 0.000075);
            return anthropic;
        }
    }

    @Data
    public static class RouterProperties {
        private String defaultProvider = "openai";
        private String defaultModel = "gpt-3.5-turbo";
    }

    @Data
    public static class UpstreamProperties {
        private long timeoutMs = 30_000;
        private int maxOutputTokens = 500;
        private int threads = 16;
    }

    // ==================== METERING ====================

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
    }

    @Data
    public static class AccountingProperties {
        private int maxRetries = 3;
        private long firstBackoffMs = 50;
        private int redriveRetries = 10;
        private long redriveBackoffMs = 1_000;
    }

    @Data
    public static class UsageProperties {
        private int retentionDays = 30;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    // ==================== ACCOUNTS ====================

    @Data
    public static class DemoAccountProperties {
        private boolean enabled = false;
        private String apiKey = "demo_fe01ce2a7fbac8fa";
        private String tier = "starter";
    }

    @Data
    public static class AdminProperties {
        private String token = "";
    }
}
