package me.golemcore.logai.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code logai.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - turn loop bounds, retry and intent detection</li>
 * <li>{@link CacheProperties} - local result cache</li>
 * <li>{@link ToolsProperties} - retrieval limits, fan-out and rate limit
 * backoff</li>
 * <li>{@link LlmProperties} - provider and model selection</li>
 * <li>{@link AwsProperties} - CloudWatch Logs client</li>
 * <li>{@link CatalogProperties} - log group catalog in the system prompt</li>
 * </ul>
 *
 * <p>
 * Values are checked once at startup by {@link ConfigurationValidator}.
 */
@Component
@ConfigurationProperties(prefix = "logai")
@Data
public class LogAiProperties {

    private AgentProperties agent = new AgentProperties();
    private CacheProperties cache = new CacheProperties();
    private ToolsProperties tools = new ToolsProperties();
    private RedactionProperties redaction = new RedactionProperties();
    private LlmProperties llm = new LlmProperties();
    private AwsProperties aws = new AwsProperties();
    private CatalogProperties catalog = new CatalogProperties();
    private ConsoleProperties console = new ConsoleProperties();

    // ==================== AGENT ====================

    @Data
    public static class AgentProperties {
        private int maxRetryAttempts = 3;
        private double timeExpansionFactor = 4.0;
        private int maxToolIterations = 10;
        private boolean autoRetryEnabled = true;
        private boolean intentDetectionEnabled = true;
        private double intentConfidenceThreshold = 0.8;
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private String directory = Path.of(System.getProperty("user.home"), ".logai", "cache").toString();
        private long capacityBytes = 500L * 1024 * 1024;
        private Duration ttl = Duration.ofHours(24);
        private Duration recencyFloor = Duration.ofSeconds(1);
        private Duration historicalAge = Duration.ofHours(24);
        private boolean caseInsensitivePrefixes = true;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int maxItemsPerCall = 100;
        private int maxItemsLimit = 1000;
        private int maxLogGroups = 50;
        private int maxLogGroupsLimit = 100;
        private int fanOutParallelism = 8;
        private RateLimitProperties rateLimit = new RateLimitProperties();
    }

    @Data
    public static class RateLimitProperties {
        private int maxAttempts = 3;
        private Duration firstBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    // ==================== REDACTION ====================

    @Data
    public static class RedactionProperties {
        private boolean enabled = true;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(60);
        private Double temperature = 0.2;
        private int maxTokens = 4096;
    }

    // ==================== AWS ====================

    @Data
    public static class AwsProperties {
        private String region = "us-east-1";
        private String profile;
        private String accessKeyId;
        private String secretAccessKey;
    }

    // ==================== CATALOG ====================

    @Data
    public static class CatalogProperties {
        private boolean preload = true;
        private int maxGroups = 5000;
        private int fullListThreshold = 500;
        private int summarySampleSize = 100;
    }

    // ==================== CONSOLE ====================

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
    }
}
