package me.golemcore.runstream.tools;

import me.golemcore.runstream.domain.service.ProcessedContentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessedContentToolsTest {

    private SaveProcessedContentTool saveTool;
    private LoadProcessedContentTool loadTool;

    @BeforeEach
    void setUp() {
        ProcessedContentStore store = new ProcessedContentStore();
        saveTool = new SaveProcessedContentTool(store);
        loadTool = new LoadProcessedContentTool(store);
    }

    @Test
    void shouldHandContentFromOneAssistantToAnother() {
        @SuppressWarnings("unchecked")
        Map<String, Object> saved = (Map<String, Object>) saveTool.execute(Map.of(
                "from_assistant_id", "asst_research",
                "to_assistant_id", "asst_writer",
                "processed_content", "three key findings"));

        assertEquals(true, saved.get("saved"));

        @SuppressWarnings("unchecked")
        Map<String, Object> loaded = (Map<String, Object>) loadTool.execute(Map.of(
                "from_assistant_id", "asst_research",
                "to_assistant_id", "asst_writer"));

        assertEquals(1, loaded.get("count"));
        assertEquals(List.of("three key findings"), loaded.get("content"));

        @SuppressWarnings("unchecked")
        Map<String, Object> again = (Map<String, Object>) loadTool.execute(Map.of(
                "from_assistant_id", "asst_research",
                "to_assistant_id", "asst_writer"));
        assertEquals(0, again.get("count"));
    }

    @Test
    void shouldLoadFromEverySenderWithMultipleRetrieval() {
        saveTool.execute(Map.of("from_assistant_id", "asst_a", "to_assistant_id", "asst_writer",
                "processed_content", "part a"));
        saveTool.execute(Map.of("from_assistant_id", "asst_b", "to_assistant_id", "asst_writer",
                "processed_content", "part b"));

        @SuppressWarnings("unchecked")
        Map<String, Object> loaded = (Map<String, Object>) loadTool.execute(Map.of(
                "to_assistant_id", "asst_writer",
                "multiple_retrieval", "true"));

        assertEquals(List.of("part a", "part b"), loaded.get("content"));
    }

    @Test
    void shouldRejectMissingParameters() {
        assertThrows(IllegalArgumentException.class, () -> saveTool.execute(Map.of(
                "to_assistant_id", "asst_writer", "processed_content", "x")));
        assertThrows(IllegalArgumentException.class, () -> saveTool.execute(Map.of(
                "from_assistant_id", "asst_a", "to_assistant_id", "asst_writer")));
        assertThrows(IllegalArgumentException.class, () -> loadTool.execute(Map.of("to_assistant_id", "asst_w")));
    }
}
