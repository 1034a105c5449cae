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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a {@link StreamEvent} as seen by output channels and push-stream
 * consumers.
 */
public enum EventKind {

    /**
     * Incremental piece of assistant output for one message.
     */
    FRAGMENT("fragment"),

    /**
     * Full text of a message once the provider marks it complete.
     */
    FINALIZED("finalized"),

    /**
     * Tool call requested by the remote run.
     */
    TOOL_CALL("tool_call"),

    /**
     * Terminal run status.
     */
    STATUS("status"),

    /**
     * Transport or provider failure. Always terminal for the run.
     */
    ERROR("error"),

    /**
     * Synthetic discontinuity marker produced during backfill. Never stored in
     * history.
     */
    GAP("gap");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
