package me.golemcore.runstream.infrastructure.config;

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
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.service.ChannelFanOutService;
import me.golemcore.runstream.domain.service.ToolInvocationService;
import me.golemcore.runstream.port.outbound.AgentGatewayPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup of the output channels.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the application {@link Clock} and {@link ObjectMapper}</li>
 * <li>Logs startup information (backend, history size, tools)</li>
 * <li>Starts the channels listed in {@code runstream.channels.active} and
 * stops them on shutdown</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RunStreamProperties properties;
    private final ChannelFanOutService channelFanOutService;
    private final ToolInvocationService toolInvocationService;
    private final AgentGatewayPort agentGateway;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("RunStream starting...");
        log.info("Agent backend: {} at {}", agentGateway.getProviderId(), properties.getGateway().getBaseUrl());
        log.info("History capacity: {} events per conversation", properties.getHistory().getCapacity());
        log.info("Tools: {}", toolInvocationService.getToolNames());
        if (properties.getGateway().getApiKey() == null || properties.getGateway().getApiKey().isBlank()) {
            log.warn("runstream.gateway.api-key is not set, backend calls will be unauthenticated");
        }

        channelFanOutService.startAll();
        log.info("RunStream started successfully");
    }

    @PreDestroy
    public void shutdown() {
        channelFanOutService.stopAll();
    }
}
