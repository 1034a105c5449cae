package me.golemcore.runstream.infrastructure.http;

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
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.TimeUnit;

/**
 * HTTP clients for the agent backend.
 *
 * <p>
 * {@link #okHttpClient()} serves short request/response calls with the timeouts
 * from {@code runstream.http.*}. {@link #streamingHttpClient(OkHttpClient)}
 * shares its connection pool but waits up to
 * {@code runstream.gateway.stream-read-timeout-ms} between bytes, since a run
 * stream can stay silent while the backend works or waits for tool output.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final RunStreamProperties properties;

    @Bean
    @Primary
    public OkHttpClient okHttpClient() {
        RunStreamProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean
    public OkHttpClient streamingHttpClient(@Qualifier("okHttpClient") OkHttpClient okHttpClient) {
        return okHttpClient.newBuilder()
                .readTimeout(properties.getGateway().getStreamReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }
}
