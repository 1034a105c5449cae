package me.golemcore.runstream.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.ConversationKey;
import me.golemcore.runstream.domain.model.ConversationSession;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every {@link ConversationSession} of the process. Sessions are created
 * on first use and live until shutdown.
 */
@Service
@Slf4j
public class ConversationRegistry {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final RunStreamProperties properties;

    public ConversationRegistry(RunStreamProperties properties) {
        this.properties = properties;
    }

    public ConversationSession getOrCreate(ConversationKey key) {
        return sessions.computeIfAbsent(key.conversationId(), id -> {
            log.debug("[Sessions] Created conversation {}", id);
            return new ConversationSession(key, properties.getHistory().getCapacity());
        });
    }

    /**
     * Resolves a conversation id string, applying the default agent id to bare
     * user ids.
     */
    public ConversationSession getOrCreate(String conversationId) {
        return getOrCreate(resolveKey(conversationId));
    }

    public Optional<ConversationSession> find(String conversationId) {
        return Optional.ofNullable(sessions.get(resolveKey(conversationId).conversationId()));
    }

    public ConversationKey resolveKey(String conversationId) {
        return ConversationKey.parse(conversationId, properties.getGateway().getDefaultAgentId());
    }

    public List<ConversationSession> listAll() {
        List<ConversationSession> all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(ConversationSession::getConversationId));
        return all;
    }
}
