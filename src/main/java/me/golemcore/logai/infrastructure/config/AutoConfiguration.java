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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.service.LogGroupCatalogService;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.security.LogRedactor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared beans and startup checks.
 *
 * <p>
 * On startup the configuration is validated, expired cache entries are
 * removed and, unless disabled, the log group catalog is preloaded.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final LogAiProperties properties;
    private final ResultCachePort resultCache;
    private final LogGroupCatalogService catalog;
    private final LogRedactor redactor;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Runs tool calls. Tool tasks wait on retrievals, so the pool grows on
     * demand instead of sharing threads with the fan-out branches.
     */
    @Bean(name = "toolExecutor", destroyMethod = "shutdownNow")
    public static ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("logai-tool"));
    }

    @Bean(name = "retrievalExecutor", destroyMethod = "shutdownNow")
    public ExecutorService retrievalExecutor() {
        return Executors.newFixedThreadPool(properties.getTools().getFanOutParallelism(),
                daemonThreads("logai-retrieval"));
    }

    @PostConstruct
    public void init() {
        ConfigurationValidator.validate(properties);
        log.info("LogAI starting...");
        log.info("LLM Provider: {} ({})", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("AWS Region: {}", properties.getAws().getRegion());
        log.info("Cache: {}", properties.getCache().isEnabled() ? properties.getCache().getDirectory() : "disabled");
        log.info("Redaction: {}", redactor.isEnabled() ? "enabled" : "DISABLED");

        int expired = resultCache.evictExpired();
        if (expired > 0) {
            log.info("Removed {} expired cache entries", expired);
        }
        if (properties.getCatalog().isPreload()) {
            catalog.load();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
