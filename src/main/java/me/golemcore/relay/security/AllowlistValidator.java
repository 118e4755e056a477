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

package me.golemcore.relay.security;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates chat users against the configured allowlist and administrator
 * list.
 *
 * <p>
 * An empty allowlist admits everyone. The administrator list has no such
 * fallback: when it is empty nobody is an administrator.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllowlistValidator {

    private final RelayProperties properties;

    /**
     * Check if a user may use the bot at all.
     */
    public boolean isAllowed(String userId) {
        log.trace("[Security] Allowlist check: user={}", userId);

        List<String> allowedUsers = properties.getTelegram().getAllowFrom();
        if (allowedUsers == null || allowedUsers.isEmpty()) {
            return true;
        }

        boolean allowed = allowedUsers.contains(userId);
        if (!allowed) {
            log.warn("[Security] Unauthorized: user={}", userId);
        }
        return allowed;
    }

    /**
     * Check if a user may run administrative commands.
     */
    public boolean isAdmin(String userId) {
        List<String> admins = properties.getSecurity().getAdminUsers();
        if (admins == null || admins.isEmpty() || userId == null) {
            return false;
        }
        return admins.contains(userId);
    }
}
