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

import me.golemcore.runstream.domain.component.ToolComponent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in {@code datetime} tool: current date and time in the requested
 * timezone, or the clock's zone when none is given.
 *
 * <p>
 * Timezone argument examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}. An invalid zone fails the call.
 */
@Component
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getToolName() {
        return "datetime";
    }

    @Override
    public String getDescription() {
        return "Get the current date and time. Optionally specify a timezone.";
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        Object timezone = arguments.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.toString().isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.toString().trim());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("datetime", now.format(FORMATTER));
        result.put("timezone", zoneId.getId());
        result.put("timestamp", now.toInstant().toEpochMilli());
        result.put("dayOfWeek", now.getDayOfWeek().name());
        result.put("year", now.getYear());
        result.put("month", now.getMonth().name());
        result.put("day", now.getDayOfMonth());
        result.put("hour", now.getHour());
        result.put("minute", now.getMinute());
        return result;
    }
}
