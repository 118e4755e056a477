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
import me.golemcore.relay.domain.model.EnableClusterRequest;
import me.golemcore.relay.domain.model.ExecutionMode;
import me.golemcore.relay.domain.model.RegisterLocalRequest;
import me.golemcore.relay.domain.model.RegisteredUser;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.SubcommandDefinition;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.port.inbound.InteractionReply;
import me.golemcore.relay.port.outbound.BackendException;
import me.golemcore.relay.port.outbound.BackendPort;
import me.golemcore.relay.security.AllowlistValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /register local|unregister|mode|status|cluster - execution endpoint
 * registration of the caller. {@code cluster} is reserved for administrators
 * and acts on the user named in its options.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegisterCommandHandler extends AbstractCommandHandler {

    static final String MSG_UNKNOWN_SUBCOMMAND = "Unknown subcommand. Use `/register local`, "
            + "`/register unregister`, `/register mode`, `/register status`, or `/register cluster`.";
    static final String MSG_URL_REQUIRED = "❌ URL is required.";
    static final String MSG_ADMIN_ONLY = "❌ Only administrators can enable cluster access.";
    static final String MSG_USER_REQUIRED = "❌ A `user` is required.";
    static final String MSG_REGISTER_FIRST =
            "\n\nYou may need to register first with `/register local url:<your-url>`";
    static final String MSG_NOT_REGISTERED = "*Not Registered*\n\n"
            + "You haven't registered yet.\n\n"
            + "To use your local machine:\n"
            + "`/register local url:http://your-ip:8000`\n\n"
            + "To use the cluster (if enabled by admin):\n"
            + "Contact an admin to enable cluster access.";

    private static final String SUBCMD_LOCAL = "local";
    private static final String SUBCMD_UNREGISTER = "unregister";
    private static final String SUBCMD_MODE = "mode";
    private static final String SUBCMD_STATUS = "status";
    private static final String SUBCMD_CLUSTER = "cluster";
    private static final String OPT_URL = "url";
    private static final String OPT_DEFAULT = "default";
    private static final String OPT_USER = "user";
    private static final String OPT_STORAGE_PATH = "storage_path";

    private static final CommandDefinition DEFINITION = CommandDefinition.grouped(
            "register",
            "Register your execution wrapper",
            "/register local <url> | /register unregister | /register mode default:local|cluster"
                    + " | /register status | /register cluster user:<id> [storage_path:<path>]",
            List.of(
                    new SubcommandDefinition(SUBCMD_LOCAL, "Register your local wrapper URL", List.of(
                            CommandOption.freeText(OPT_URL, "Your wrapper URL (e.g., http://your-ip:8000)", true))),
                    new SubcommandDefinition(SUBCMD_UNREGISTER, "Unregister your local wrapper", List.of()),
                    new SubcommandDefinition(SUBCMD_MODE, "Set your default execution mode", List.of(
                            CommandOption.choice(OPT_DEFAULT, "Default mode for tasks",
                                    List.of("local", "cluster")))),
                    new SubcommandDefinition(SUBCMD_STATUS, "Check your registration status", List.of()),
                    new SubcommandDefinition(SUBCMD_CLUSTER, "Enable cluster access for a user (admin)", List.of(
                            CommandOption.user(OPT_USER, "The user to enable", true),
                            CommandOption.text(OPT_STORAGE_PATH, "Storage path on the cluster", false)))),
            SUBCMD_STATUS);

    private final BackendPort backendPort;
    private final AllowlistValidator allowlistValidator;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        String subcommand = invocation.getSubcommand() != null ? invocation.getSubcommand() : SUBCMD_STATUS;
        UserIdentity actor = invocation.getActor();
        log.info("[Command] /register {} from {}", subcommand, actor.id());

        return switch (subcommand) {
        case SUBCMD_LOCAL -> handleLocal(invocation, actor, reply);
        case SUBCMD_UNREGISTER -> handleUnregister(actor, reply);
        case SUBCMD_MODE -> handleMode(invocation, actor, reply);
        case SUBCMD_STATUS -> handleStatus(actor, reply);
        case SUBCMD_CLUSTER -> handleCluster(invocation, actor, reply);
        default -> respond(reply, MSG_UNKNOWN_SUBCOMMAND);
        };
    }

    private CompletableFuture<Void> handleLocal(CommandInvocation invocation, UserIdentity actor,
            InteractionReply reply) {
        Optional<String> url = invocation.option(OPT_URL);
        if (url.isEmpty()) {
            return respond(reply, MSG_URL_REQUIRED);
        }

        RegisterLocalRequest request = RegisterLocalRequest.builder()
                .discordId(actor.id())
                .discordName(actor.nameOrId())
                .wrapperUrl(url.get())
                .build();

        return acknowledgeThenEdit("register local", reply, "⏳ Registering your wrapper...",
                () -> backendPort.registerLocal(request),
                user -> RenderedReply.of(formatRegistered(user)),
                error -> failure("Failed to register", error));
    }

    private CompletableFuture<Void> handleUnregister(UserIdentity actor, InteractionReply reply) {
        return acknowledgeThenEdit("register unregister", reply, "⏳ Unregistering your wrapper...",
                () -> backendPort.unregisterLocal(actor.id()),
                ignored -> RenderedReply.of("✅ Local wrapper unregistered."),
                error -> failure("Failed to unregister", error));
    }

    private CompletableFuture<Void> handleMode(CommandInvocation invocation, UserIdentity actor,
            InteractionReply reply) {
        ExecutionMode mode = ExecutionMode.fromUserInput(invocation.option(OPT_DEFAULT).orElse(null));

        return acknowledgeThenEdit("register mode", reply, "⏳ Updating default mode...",
                () -> backendPort.setMode(actor.id(), mode),
                user -> RenderedReply.of("✅ Default mode set to *" + user.getDefaultMode() + "*" + DOUBLE_NEWLINE
                        + "Your tasks will now run on: "
                        + (ExecutionMode.CLUSTER.getCode().equals(user.getDefaultMode())
                                ? "the cluster"
                                : "your local machine")),
                error -> failure("Failed to set mode", error) + MSG_REGISTER_FIRST);
    }

    private CompletableFuture<Void> handleStatus(UserIdentity actor, InteractionReply reply) {
        return acknowledgeThenEdit("register status", reply, "⏳ Checking your registration...",
                () -> backendPort.getUser(actor.id()),
                user -> RenderedReply.of(formatStatus(user)),
                error -> error instanceof BackendException backendError && backendError.isNotFound()
                        ? MSG_NOT_REGISTERED
                        : failure("Failed to get registration status", error));
    }

    private CompletableFuture<Void> handleCluster(CommandInvocation invocation, UserIdentity actor,
            InteractionReply reply) {
        if (!allowlistValidator.isAdmin(actor.id())) {
            log.warn("[Command] Non-admin {} tried to enable cluster access", actor.id());
            return respond(reply, MSG_ADMIN_ONLY);
        }
        Optional<UserIdentity> user = invocation.userOption(OPT_USER);
        if (user.isEmpty()) {
            return respond(reply, MSG_USER_REQUIRED);
        }

        EnableClusterRequest request = EnableClusterRequest.builder()
                .discordId(user.get().id())
                .discordName(user.get().nameOrId())
                .storagePath(invocation.option(OPT_STORAGE_PATH).orElse(null))
                .build();

        return acknowledgeThenEdit("register cluster", reply, "⏳ Enabling cluster access...",
                () -> backendPort.enableCluster(request),
                registered -> RenderedReply.of("✅ *Cluster Access Enabled*" + DOUBLE_NEWLINE
                        + "*User:* `" + registered.getDiscordId() + "`\n"
                        + "*Storage:* `" + orDefault(registered.getClusterStoragePath(), "default") + "`"),
                error -> failure("Failed to enable cluster access", error));
    }

    static String formatRegistered(RegisteredUser user) {
        return "✅ *Local Wrapper Registered*" + DOUBLE_NEWLINE
                + "*URL:* `" + orDefault(user.getLocalWrapperUrl(), "") + "`\n"
                + "*Default Mode:* " + user.getDefaultMode() + DOUBLE_NEWLINE
                + "Now run the wrapper on your machine:\n"
                + "```bash\n"
                + "cd wrapper && uvicorn wrapper.main:app --host 0.0.0.0 --port 8000\n"
                + "```" + DOUBLE_NEWLINE
                + "Then use `/task prompt:\"...\" project:my-project` to run tasks!";
    }

    static String formatStatus(RegisteredUser user) {
        String local = user.getLocalWrapperUrl() != null
                ? "✅ Registered: `" + user.getLocalWrapperUrl() + "`"
                : "❌ Not registered";
        String cluster = user.isClusterEnabled()
                ? "✅ Enabled (storage: `" + orDefault(user.getClusterStoragePath(), "") + "`)"
                : "❌ Not enabled";
        return "*Your Registration Status*" + DOUBLE_NEWLINE
                + "*User ID:* `" + user.getDiscordId() + "`\n"
                + "*Local Wrapper:* " + local + "\n"
                + "*Cluster Access:* " + cluster + "\n"
                + "*Default Mode:* `" + user.getDefaultMode() + "`\n"
                + "*Last Seen:* " + orDefault(user.getLastSeen(), "never");
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
