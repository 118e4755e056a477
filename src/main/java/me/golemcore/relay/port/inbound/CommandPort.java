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

package me.golemcore.relay.port.inbound;

import me.golemcore.relay.domain.model.CommandDefinition;
import me.golemcore.relay.domain.model.CommandInvocation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for executing slash commands (/task, /status, /approve, etc.) received
 * from a channel.
 */
public interface CommandPort {

    /**
     * Executes a command and delivers every response through {@code reply}.
     *
     * @return completes once the final response (and follow-ups) has been
     *         attempted; never completes exceptionally for a handled failure
     */
    CompletableFuture<Void> execute(CommandInvocation invocation, InteractionReply reply);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns all available commands with their definitions.
     */
    List<CommandDefinition> listCommands();
}
