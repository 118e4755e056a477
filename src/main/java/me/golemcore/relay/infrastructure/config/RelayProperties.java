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

package me.golemcore.relay.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - bot token, command scope, allowlist</li>
 * <li>{@link BackendProperties} - task backend base URL</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link SecurityProperties} - administrator identities</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private BackendProperties backend = new BackendProperties();
    private HttpProperties http = new HttpProperties();
    private SecurityProperties security = new SecurityProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
        /**
         * Group chat the commands are registered for. Global scope when unset.
         */
        private String commandScopeChatId;
        private List<String> allowFrom = new ArrayList<>();
    }

    @Data
    public static class BackendProperties {
        private String url = "http://localhost:8000";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10_000;
        /**
         * Task submission holds the connection until the task finishes, so
         * reads are unbounded by default. Zero means no timeout.
         */
        private long readTimeout = 0;
        private long writeTimeout = 10_000;
        /**
         * Whole-call limit. Zero means no timeout.
         */
        private long callTimeout = 0;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300_000;
    }

    @Data
    public static class SecurityProperties {
        private List<String> adminUsers = new ArrayList<>();
    }
}
