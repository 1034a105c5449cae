package me.golemcore.runstream;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main Spring Boot application class for RunStream.
 *
 * <p>
 * RunStream sits between a conversational-agent backend and a set of output
 * channels. It streams each run of an agent, executes the local tools the run
 * asks for, and fans the resulting event sequence out to every channel:
 * <ul>
 * <li>Console - run output printed as it arrives</li>
 * <li>Push stream - Server-Sent Events for browsers, with backfill on
 * reconnect</li>
 * <li>Redis - JSON events on a pub/sub topic</li>
 * </ul>
 *
 * <p>
 * The application follows hexagonal architecture with clear separation between
 * domain logic (sessions, history, routing, tools) and adapters (HTTP gateway,
 * channels, web endpoints).
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RunStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(RunStreamApplication.class, args);
    }
}
