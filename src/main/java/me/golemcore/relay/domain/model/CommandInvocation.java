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

package me.golemcore.relay.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * One structured command invocation received from a channel.
 *
 * <p>
 * {@code actor} comes from the channel's authenticated context. User-typed
 * options hold user ids; display names the channel could resolve are kept in
 * {@code resolvedUsers}.
 */
@Value
@Builder(toBuilder = true)
public class CommandInvocation {

    String command;
    String subcommand;
    UserIdentity actor;
    String chatId;
    String channelType;

    @Builder.Default
    Map<String, String> options = Map.of();

    @Builder.Default
    Map<String, UserIdentity> resolvedUsers = Map.of();

    /**
     * Non-blank value of a string option.
     */
    public Optional<String> option(String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    /**
     * User-typed option resolved to an identity, with display name when the
     * channel supplied one.
     */
    public Optional<UserIdentity> userOption(String name) {
        return option(name).map(id -> {
            UserIdentity resolved = resolvedUsers.get(id);
            return resolved != null ? resolved : UserIdentity.of(id);
        });
    }
}
