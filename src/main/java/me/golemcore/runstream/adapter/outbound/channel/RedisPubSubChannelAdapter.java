package me.golemcore.runstream.adapter.outbound.channel;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import me.golemcore.runstream.port.outbound.OutputChannelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes every event as JSON to a Redis pub/sub topic. Delivery is best
 * effort: Redis keeps nothing for subscribers that are not connected.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code runstream.redis.topic} - pub/sub channel name
 * <li>{@code spring.data.redis.*} - connection settings
 * </ul>
 */
@Component
@Slf4j
public class RedisPubSubChannelAdapter implements OutputChannelPort {

    static final String CHANNEL_TYPE = "redis";

    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final ObjectMapper objectMapper;
    private final RunStreamProperties properties;
    private volatile StringRedisTemplate redisTemplate;
    private volatile boolean running;

    public RedisPubSubChannelAdapter(ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectMapper objectMapper, RunStreamProperties properties) {
        this.redisTemplateProvider = redisTemplateProvider;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate == null) {
            log.warn("[Redis] No StringRedisTemplate available, channel stays stopped");
            return;
        }
        running = true;
        log.info("[Redis] Publishing events to topic '{}'", properties.getRedis().getTopic());
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public PublishOutcome publish(StreamEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[Redis] Failed to serialize seq {} of {}: {}", event.sequenceNo(), event.conversationId(),
                    e.getOriginalMessage());
            return PublishOutcome.failed(CHANNEL_TYPE, "serialization failed: " + e.getOriginalMessage());
        }
        Long receivers = redisTemplate.convertAndSend(properties.getRedis().getTopic(), json);
        return PublishOutcome.delivered(CHANNEL_TYPE, "receivers=" + (receivers != null ? receivers : 0));
    }
}
