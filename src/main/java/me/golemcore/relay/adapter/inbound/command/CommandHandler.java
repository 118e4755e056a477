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

package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.CommandDefinition;
import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.port.inbound.InteractionReply;

import java.util.concurrent.CompletableFuture;

/**
 * Handler for one slash command. Implementations are discovered as Spring
 * beans and registered with {@link CommandRouter} under
 * {@code definition().name()}.
 */
public interface CommandHandler {

    CommandDefinition definition();

    /**
     * Runs the command and delivers its responses through {@code reply}. The
     * returned future completes once the last response has been attempted.
     */
    CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply);
}
