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
import java.util.Map;

/**
 * Built-in {@code save_processed_content} tool: leaves content prepared by one
 * assistant for another to pick up with {@code load_processed_content}.
 */
@Component
@RequiredArgsConstructor
public class SaveProcessedContentTool implements ToolComponent {

    public static final String TOOL_NAME = "save_processed_content";

    static final String PARAM_FROM = "from_assistant_id";
    static final String PARAM_TO = "to_assistant_id";
    static final String PARAM_CONTENT = "processed_content";

    private final ProcessedContentStore store;

    @Override
    public String getToolName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Store processed content for another assistant.";
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String from = ToolArguments.requireText(arguments, PARAM_FROM);
        String to = ToolArguments.requireText(arguments, PARAM_TO);
        store.save(from, to, arguments.get(PARAM_CONTENT));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("saved", true);
        result.put("from", from);
        result.put("to", to);
        return result;
    }
}
