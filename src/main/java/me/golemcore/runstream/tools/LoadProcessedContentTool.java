package me.golemcore.runstream.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.runstream.domain.component.ToolComponent;
import me.golemcore.runstream.domain.service.ProcessedContentStore;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in {@code load_processed_content} tool.
 *
 * <p>
 * By default it takes, and removes, what {@code from_assistant_id} left for
 * {@code to_assistant_id}. With {@code multiple_retrieval} set it returns
 * everything addressed to {@code to_assistant_id} by any sender and keeps it
 * stored.
 */
@Component
@RequiredArgsConstructor
public class LoadProcessedContentTool implements ToolComponent {

    public static final String TOOL_NAME = "load_processed_content";

    static final String PARAM_FROM = "from_assistant_id";
    static final String PARAM_TO = "to_assistant_id";
    static final String PARAM_MULTIPLE = "multiple_retrieval";

    private final ProcessedContentStore store;

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Load processed content another assistant stored for this one.";
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String to = ToolArguments.requireText(arguments, PARAM_TO);
        boolean multiple = ToolArguments.flag(arguments, PARAM_MULTIPLE);
        List<Object> content;
        if (multiple) {
            content = store.collectFor(to);
        } else {
            content = store.take(ToolArguments.requireText(arguments, PARAM_FROM), to);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("to", to);
        result.put("count", content.size());
        result.put("content", content);
        return result;
    }
}
