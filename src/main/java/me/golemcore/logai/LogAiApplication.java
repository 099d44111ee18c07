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

package me.golemcore.logai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for LogAI.
 *
 * <p>
 * LogAI answers natural-language questions about AWS CloudWatch logs. An LLM
 * decides which retrievals to run; results pass through a local cache and a
 * redaction layer before the model sees them.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChatRunner
 * Domain Layer       → TurnOrchestrator, LogRetrievalService, tools
 * Infrastructure     → CloudWatch, langchain4j and file cache adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code logai.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LogAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogAiApplication.class, args);
    }

}
