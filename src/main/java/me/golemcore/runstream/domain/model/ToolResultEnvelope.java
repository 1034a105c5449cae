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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

/**
 * Uniform result of a tool invocation, submitted back to the remote run as the
 * tool output. Serialized as {@code {"status", "message", "result"}}; the
 * failure kind stays local.
 */
@Data
@Builder
@JsonPropertyOrder({ "status", "message", "result" })
public class ToolResultEnvelope {

    public static final String SUCCESS_MESSAGE = "Success";

    private boolean status;
    private String message;
    private Object result;

    @JsonIgnore
    private ToolFailureKind failureKind;

    /**
     * Creates a successful envelope carrying the tool output.
     */
    public static ToolResultEnvelope success(Object result) {
        return ToolResultEnvelope.builder()
                .status(true)
                .message(SUCCESS_MESSAGE)
                .result(result)
                .build();
    }

    /**
     * Creates a failed envelope. The result is always null.
     */
    public static ToolResultEnvelope failure(ToolFailureKind kind, String message) {
        return ToolResultEnvelope.builder()
                .status(false)
                .message(message)
                .failureKind(kind)
                .build();
    }
}
