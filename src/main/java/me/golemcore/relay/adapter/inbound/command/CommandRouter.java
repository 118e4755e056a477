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
import me.golemcore.relay.domain.service.TaskPresenter;
import me.golemcore.relay.port.inbound.CommandPort;
import me.golemcore.relay.port.inbound.InteractionReply;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes slash commands to their handlers.
 *
 * <p>
 * Commands:
 * <ul>
 * <li>/task - Submit a task
 * <li>/status - Show a task with its full output
 * <li>/approve - Answer a pending approval
 * <li>/project list|add|remove - Manage projects
 * <li>/register local|unregister|mode|status|cluster - Manage registration
 * <li>/share add|remove|list|available - Manage wrapper sharing
 * <li>/sessions list|end - Manage backend sessions
 * <li>/help - Show available commands
 * </ul>
 *
 * <p>
 * Every invocation maps to exactly one handler. Unknown commands and
 * {@code /help} are answered here without contacting the backend.
 *
 * @see me.golemcore.relay.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_HELP = "help";
    private static final List<String> DISPLAY_ORDER = List.of(
            "task", "status", "approve", "project", "register", "share", "sessions");

    private static final CommandDefinition HELP = CommandDefinition.simple(
            CMD_HELP, "Show available commands", "/help", List.of());

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public CommandRouter(List<CommandHandler> commandHandlers) {
        commandHandlers.stream()
                .sorted(Comparator.comparingInt(handler -> displayIndex(handler.definition().name())))
                .forEach(handler -> {
                    String name = handler.definition().name();
                    if (handlers.putIfAbsent(name, handler) != null) {
                        throw new IllegalStateException("Duplicate command handler for /" + name);
                    }
                });
        log.info("CommandRouter initialized with commands: {}", handlers.keySet());
    }

    @Override
    public CompletableFuture<Void> execute(CommandInvocation invocation, InteractionReply reply) {
        String command = invocation.getCommand();
        if (CMD_HELP.equals(command)) {
            return send(reply, helpText());
        }

        CommandHandler handler = handlers.get(command);
        if (handler == null) {
            log.debug("[Command] Unknown command: /{}", command);
            return send(reply, "Unknown command: /" + command + ". Use /help to see available commands.");
        }

        try {
            return handler.handle(invocation, reply)
                    .exceptionally(e -> {
                        log.error("[Command] /{} failed unexpectedly", command, e);
                        return null;
                    });
        } catch (RuntimeException e) {
            log.error("[Command] /{} failed", command, e);
            return send(reply, "❌ *Command Failed*\n\n" + TaskPresenter.fenced(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    @Override
    public boolean hasCommand(String command) {
        return CMD_HELP.equals(command) || handlers.containsKey(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        List<CommandDefinition> definitions = new ArrayList<>();
        handlers.values().forEach(handler -> definitions.add(handler.definition()));
        definitions.add(HELP);
        return definitions;
    }

    String helpText() {
        StringBuilder sb = new StringBuilder("*Available Commands*\n");
        for (CommandDefinition definition : listCommands()) {
            sb.append("\n/").append(definition.name()).append(" - ").append(definition.description())
                    .append("\n`").append(definition.usage()).append('`');
        }
        return sb.toString();
    }

    private CompletableFuture<Void> send(InteractionReply reply, String content) {
        try {
            return reply.respond(content)
                    .exceptionally(e -> {
                        log.error("[Command] Failed to send response: {}", e.getMessage());
                        return null;
                    });
        } catch (RuntimeException e) {
            log.error("[Command] Failed to send response", e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private static int displayIndex(String name) {
        int index = DISPLAY_ORDER.indexOf(name);
        return index >= 0 ? index : DISPLAY_ORDER.size();
    }
}
