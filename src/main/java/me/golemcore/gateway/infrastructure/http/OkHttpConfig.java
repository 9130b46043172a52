package me.golemcore.gateway.infrastructure.http;

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
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for upstream provider calls, configured from
 * {@code gateway.http.*}.
 *
 * <p>
 * The read timeout bounds the gap between two streamed chunks, not the whole
 * response, so long generations are not cut off. Every streaming exchange
 * holds a request open for its whole duration, so the per-host request limit
 * is raised above the OkHttp default of five.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final GatewayProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        GatewayProperties.HttpProperties http = properties.getHttp();

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(Math.max(http.getMaxRequests(), http.getMaxRequestsPerHost()));
        dispatcher.setMaxRequestsPerHost(http.getMaxRequestsPerHost());

        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                // completions are billed; a silent replay would charge twice
                .retryOnConnectionFailure(false)
                .build();
    }
}
