package me.golemcore.runstream.domain.component;

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

import java.util.Map;

/**
 * Local tool that a remote run can call while it is suspended. The tool schema
 * lives with the agent definition on the backend; locally a tool is just a
 * name bound to a callable.
 */
public interface ToolComponent {

    /**
     * Returns the unique name of this tool, matching the function name the
     * backend sends in tool calls.
     *
     * @return the tool name
     */
    String getToolName();

    /**
     * Executes the tool. The returned value must be serializable to JSON (maps,
     * lists, strings, numbers, booleans or records). Any exception becomes a
     * failure envelope.
     *
     * @param arguments
     *            decoded call arguments, never null
     * @return the structured tool output
     */
    Object execute(Map<String, Object> arguments) throws Exception;

    default String getDescription() {
        return "";
    }

    default boolean isEnabled() {
        return true;
    }
}
