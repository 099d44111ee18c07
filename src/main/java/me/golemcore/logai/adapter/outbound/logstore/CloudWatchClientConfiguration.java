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

package me.golemcore.logai.adapter.outbound.logstore;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;

/**
 * CloudWatch Logs client wiring. Credentials come from static keys when both
 * are configured, then from a named profile, then from the default chain.
 */
@Configuration
@Slf4j
public class CloudWatchClientConfiguration {

    @Bean(destroyMethod = "close")
    public CloudWatchLogsClient cloudWatchLogsClient(LogAiProperties properties) {
        LogAiProperties.AwsProperties aws = properties.getAws();
        log.info("[CloudWatch] Creating client for region {}", aws.getRegion());
        return CloudWatchLogsClient.builder()
                .region(Region.of(aws.getRegion()))
                .credentialsProvider(credentialsProvider(aws))
                .build();
    }

    static AwsCredentialsProvider credentialsProvider(LogAiProperties.AwsProperties aws) {
        if (hasText(aws.getAccessKeyId()) && hasText(aws.getSecretAccessKey())) {
            log.debug("[CloudWatch] Using static credentials");
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(aws.getAccessKeyId(), aws.getSecretAccessKey()));
        }
        if (hasText(aws.getProfile())) {
            log.debug("[CloudWatch] Using profile {}", aws.getProfile());
            return ProfileCredentialsProvider.create(aws.getProfile());
        }
        return DefaultCredentialsProvider.create();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
