package me.golemcore.runstream.domain.model;

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

import lombok.Builder;

import java.util.List;

/**
 * Provider-neutral view of one notification read from a run stream.
 *
 * <p>
 * Only the fields relevant to the {@link RunNotificationType} are populated:
 * deltas carry {@code messageId} and {@code text}, requires-action carries
 * {@code toolCalls}, terminal notifications carry {@code status} and, for
 * failures, {@code errorMessage}. {@code sourceEvent} keeps the provider's
 * event name for logging.
 */
@Builder
public record RunNotification(RunNotificationType type, String sourceEvent, String threadId, String runId,
        String messageId, String text, RunStatus status, List<ToolCall> toolCalls, String errorMessage) {

    public RunNotification {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static RunNotification done() {
        return RunNotification.builder()
                .type(RunNotificationType.DONE)
                .sourceEvent("done")
                .build();
    }
}
