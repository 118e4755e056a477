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
import me.golemcore.relay.domain.model.CommandOption;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.SessionInfo;
import me.golemcore.relay.domain.model.SubcommandDefinition;
import me.golemcore.relay.port.inbound.InteractionReply;
import me.golemcore.relay.port.outbound.BackendPort;
import me.golemcore.relay.security.AllowlistValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /sessions list|end - backend conversation sessions. The backend does not
 * scope sessions by user, so the command is restricted to administrators.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionsCommandHandler extends AbstractCommandHandler {

    static final String MSG_UNKNOWN_SUBCOMMAND = "Unknown subcommand. Use `/sessions list` or `/sessions end`.";
    static final String MSG_ADMIN_ONLY = "❌ Only administrators can manage sessions.";
    static final String MSG_SESSION_ID_REQUIRED = "❌ A `session_id` is required.";

    private static final String SUBCMD_LIST = "list";
    private static final String SUBCMD_END = "end";
    private static final String OPT_SESSION_ID = "session_id";

    private static final CommandDefinition DEFINITION = CommandDefinition.grouped(
            "sessions",
            "List or end backend sessions (admin only)",
            "/sessions list | /sessions end <session_id>",
            List.of(
                    new SubcommandDefinition(SUBCMD_LIST, "List active sessions", List.of()),
                    new SubcommandDefinition(SUBCMD_END, "Terminate a session", List.of(
                            CommandOption.freeText(OPT_SESSION_ID, "The session ID to terminate", true)))),
            SUBCMD_LIST);

    private final BackendPort backendPort;
    private final AllowlistValidator allowlistValidator;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        String subcommand = invocation.getSubcommand() != null ? invocation.getSubcommand() : SUBCMD_LIST;
        log.info("[Command] /sessions {} from {}", subcommand, invocation.getActor().id());
        if (!allowlistValidator.isAdmin(invocation.getActor().id())) {
            log.warn("[Command] Non-admin {} tried to manage sessions", invocation.getActor().id());
            return respond(reply, MSG_ADMIN_ONLY);
        }

        return switch (subcommand) {
        case SUBCMD_LIST -> acknowledgeThenEdit("sessions list", reply, "⏳ Loading sessions...",
                backendPort::listSessions,
                sessions -> RenderedReply.of(formatSessions(sessions)),
                error -> failure("Failed to list sessions", error));
        case SUBCMD_END -> handleEnd(invocation, reply);
        default -> respond(reply, MSG_UNKNOWN_SUBCOMMAND);
        };
    }

    private CompletableFuture<Void> handleEnd(CommandInvocation invocation, InteractionReply reply) {
        Optional<String> sessionId = invocation.option(OPT_SESSION_ID);
        if (sessionId.isEmpty()) {
            return respond(reply, MSG_SESSION_ID_REQUIRED);
        }
        return acknowledgeThenEdit("sessions end", reply, "⏳ Ending session...",
                () -> backendPort.terminateSession(sessionId.get()),
                ignored -> RenderedReply.of("✅ Session `" + sessionId.get() + "` terminated."),
                error -> failure("Failed to end session", error));
    }

    static String formatSessions(List<SessionInfo> sessions) {
        if (sessions.isEmpty()) {
            return "*Sessions*" + DOUBLE_NEWLINE + "No active sessions.";
        }
        StringBuilder sb = new StringBuilder("*Sessions* (").append(sessions.size()).append(")\n");
        for (SessionInfo session : sessions) {
            sb.append("\n- `").append(session.getSessionId()).append("` ")
                    .append(session.getStatus() != null ? session.getStatus() : "unknown")
                    .append(", ").append(session.getTaskCount()).append(" task(s)");
            if (session.getLastActivity() != null) {
                sb.append(", last activity ").append(session.getLastActivity());
            }
        }
        return sb.toString();
    }
}
