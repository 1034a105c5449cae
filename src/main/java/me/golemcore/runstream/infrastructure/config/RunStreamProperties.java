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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code runstream.*} prefix:
 * <ul>
 * <li>{@link GatewayProperties} - upstream agent backend</li>
 * <li>{@link HistoryProperties} - rolling event history</li>
 * <li>{@link ToolsProperties} - tool invocation limits</li>
 * <li>{@link ChannelsProperties} - active output channels</li>
 * <li>{@link PushStreamProperties} - browser push-stream consumers</li>
 * <li>{@link TurnProperties} - behaviour for messages arriving mid-run</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "runstream")
@Data
public class RunStreamProperties {

    private GatewayProperties gateway = new GatewayProperties();
    private HistoryProperties history = new HistoryProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ChannelsProperties channels = new ChannelsProperties();
    private PushStreamProperties pushStream = new PushStreamProperties();
    private RedisChannelProperties redis = new RedisChannelProperties();
    private TurnProperties turn = new TurnProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== GATEWAY ====================

    @Data
    public static class GatewayProperties {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String betaHeader = "assistants=v2";
        private String defaultAgentId;
        private long streamReadTimeoutMs = 300000;
    }

    // ==================== HISTORY ====================

    @Data
    public static class HistoryProperties {
        private int capacity = 300;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int timeoutSeconds = 30;
        private int maxOutputTokens = 16000;
        private double charsPerToken = 3.5;
        private int poolSize = 4;
    }

    // ==================== CHANNELS ====================

    @Data
    public static class ChannelsProperties {
        private List<String> active = new ArrayList<>(List.of("console", "push-stream"));
        private int dispatchQueueCapacity = 1000;
    }

    @Data
    public static class PushStreamProperties {
        private int maxQueuedEvents = 1000;
        private long pollIntervalMs = 300;
        private long keepAliveSeconds = 15;
    }

    @Data
    public static class RedisChannelProperties {
        private String topic = "runstream.events";
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        private BusyPolicy busyPolicy = BusyPolicy.REJECT;
        private int maxQueuedMessages = 100;
    }

    public enum BusyPolicy {
        REJECT, QUEUE
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
