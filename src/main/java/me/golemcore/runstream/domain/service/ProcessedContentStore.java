package me.golemcore.runstream.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory hand-off area for content one assistant prepares for another.
 * Entries are keyed by the (sender, recipient) pair and kept in insertion
 * order. Nothing survives a restart.
 */
@Service
@Slf4j
public class ProcessedContentStore {

    private final Map<Route, List<Object>> contentByRoute = new LinkedHashMap<>();

    /**
     * Appends one piece of content for the recipient.
     *
     * @throws IllegalArgumentException
     *             if either assistant id is blank or the content is empty
     */
    public synchronized void save(String fromAssistantId, String toAssistantId, Object content) {
        if (isBlank(fromAssistantId) || isBlank(toAssistantId)) {
            throw new IllegalArgumentException("from and to assistant ids are required");
        }
        if (content == null || content instanceof String text && text.isBlank()) {
            throw new IllegalArgumentException("processed content must not be empty");
        }
        contentByRoute.computeIfAbsent(new Route(fromAssistantId, toAssistantId), key -> new ArrayList<>())
                .add(content);
        log.debug("[ProcessedContent] Stored content from {} for {}", fromAssistantId, toAssistantId);
    }

    /**
     * Removes and returns everything the sender left for the recipient.
     */
    public synchronized List<Object> take(String fromAssistantId, String toAssistantId) {
        List<Object> content = contentByRoute.remove(new Route(fromAssistantId, toAssistantId));
        return content != null ? List.copyOf(content) : List.of();
    }

    /**
     * Returns everything any sender left for the recipient without removing it.
     */
    public synchronized List<Object> collectFor(String toAssistantId) {
        List<Object> content = new ArrayList<>();
        for (Map.Entry<Route, List<Object>> entry : contentByRoute.entrySet()) {
            if (entry.getKey().to().equals(toAssistantId)) {
                content.addAll(entry.getValue());
            }
        }
        return content;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Route(String from, String to) {
    }
}
