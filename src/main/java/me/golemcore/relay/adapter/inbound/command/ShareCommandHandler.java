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

import me.golemcore.relay.domain.model.AccessibleWrapper;
import me.golemcore.relay.domain.model.CommandDefinition;
import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.CommandOption;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.SubcommandDefinition;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.domain.service.AccessResolver;
import me.golemcore.relay.port.inbound.InteractionReply;
import me.golemcore.relay.port.outbound.BackendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /share add|remove|list|available - delegation of the caller's execution
 * endpoint to other users. The owner side is always the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShareCommandHandler extends AbstractCommandHandler {

    static final String MSG_UNKNOWN_SUBCOMMAND = "Unknown subcommand. Use `/share add`, `/share remove`, "
            + "`/share list`, or `/share available`.";
    static final String MSG_USER_TO_ADD_REQUIRED = "Please specify a user to share with.";
    static final String MSG_USER_TO_REMOVE_REQUIRED = "Please specify a user to remove.";

    private static final String SUBCMD_ADD = "add";
    private static final String SUBCMD_REMOVE = "remove";
    private static final String SUBCMD_LIST = "list";
    private static final String SUBCMD_AVAILABLE = "available";
    private static final String OPT_USER = "user";
    private static final String SHARED_COUNT = "*Currently shared with:* ";

    private static final CommandDefinition DEFINITION = CommandDefinition.grouped(
            "share",
            "Share your wrapper with other users",
            "/share add <user> | /share remove <user> | /share list | /share available",
            List.of(
                    new SubcommandDefinition(SUBCMD_ADD, "Grant another user access to your wrapper", List.of(
                            CommandOption.user(OPT_USER, "The user to grant access to", true).asFreeText())),
                    new SubcommandDefinition(SUBCMD_REMOVE, "Remove a user's access to your wrapper", List.of(
                            CommandOption.user(OPT_USER, "The user to remove access from", true).asFreeText())),
                    new SubcommandDefinition(SUBCMD_LIST, "List users who have access to your wrapper", List.of()),
                    new SubcommandDefinition(SUBCMD_AVAILABLE,
                            "List wrappers you have access to (your own + shared with you)", List.of())),
            SUBCMD_LIST);

    private final BackendPort backendPort;
    private final AccessResolver accessResolver;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        String subcommand = invocation.getSubcommand() != null ? invocation.getSubcommand() : SUBCMD_LIST;
        UserIdentity owner = accessResolver.shareOwner(invocation);
        log.info("[Command] /share {} from {}", subcommand, owner.id());

        return switch (subcommand) {
        case SUBCMD_ADD -> handleAdd(invocation, owner, reply);
        case SUBCMD_REMOVE -> handleRemove(invocation, owner, reply);
        case SUBCMD_LIST -> handleList(owner, reply);
        case SUBCMD_AVAILABLE -> handleAvailable(owner, reply);
        default -> respond(reply, MSG_UNKNOWN_SUBCOMMAND);
        };
    }

    private CompletableFuture<Void> handleAdd(CommandInvocation invocation, UserIdentity owner,
            InteractionReply reply) {
        Optional<UserIdentity> target = invocation.userOption(OPT_USER);
        if (target.isEmpty()) {
            return respond(reply, MSG_USER_TO_ADD_REQUIRED);
        }
        if (accessResolver.isSelfShare(owner, target.get())) {
            return respond(reply, AccessResolver.SELF_SHARE_DENIAL);
        }
        UserIdentity user = target.get();

        return acknowledgeThenEdit("share add", reply, "⏳ Sharing your wrapper...",
                () -> backendPort.share(owner.id(), user.id()),
                sharedWith -> RenderedReply.of("*Wrapper Shared*" + DOUBLE_NEWLINE
                        + describe(user) + " now has access to your wrapper." + DOUBLE_NEWLINE
                        + "They can use it with:\n"
                        + "`/task prompt:\"...\" target:" + owner.id() + "`" + DOUBLE_NEWLINE
                        + SHARED_COUNT + sharedWith.size() + " user(s)"),
                error -> failure("Failed to share wrapper", error));
    }

    private CompletableFuture<Void> handleRemove(CommandInvocation invocation, UserIdentity owner,
            InteractionReply reply) {
        Optional<UserIdentity> target = invocation.userOption(OPT_USER);
        if (target.isEmpty()) {
            return respond(reply, MSG_USER_TO_REMOVE_REQUIRED);
        }
        UserIdentity user = target.get();

        return acknowledgeThenEdit("share remove", reply, "⏳ Removing access...",
                () -> backendPort.unshare(owner.id(), user.id()),
                sharedWith -> RenderedReply.of("*Access Removed*" + DOUBLE_NEWLINE
                        + describe(user) + " no longer has access to your wrapper." + DOUBLE_NEWLINE
                        + SHARED_COUNT + sharedWith.size() + " user(s)"),
                error -> failure("Failed to remove access", error));
    }

    private CompletableFuture<Void> handleList(UserIdentity owner, InteractionReply reply) {
        return acknowledgeThenEdit("share list", reply, "⏳ Loading your sharing settings...",
                () -> backendPort.listShared(owner.id()),
                sharedWith -> RenderedReply.of(formatShared(sharedWith)),
                error -> failure("Failed to list shared users", error));
    }

    private CompletableFuture<Void> handleAvailable(UserIdentity owner, InteractionReply reply) {
        return acknowledgeThenEdit("share available", reply, "⏳ Loading available wrappers...",
                () -> backendPort.listAccessibleWrappers(owner.id()),
                wrappers -> RenderedReply.of(formatAvailable(wrappers)),
                error -> failure("Failed to list accessible wrappers", error));
    }

    static String formatShared(List<String> sharedWith) {
        if (sharedWith.isEmpty()) {
            return "*Your Wrapper Sharing*" + DOUBLE_NEWLINE
                    + "You haven't shared your wrapper with anyone." + DOUBLE_NEWLINE
                    + "Use `/share add user:<user-id>` to grant access.";
        }
        StringBuilder sb = new StringBuilder("*Your Wrapper Sharing*")
                .append(DOUBLE_NEWLINE)
                .append("Your wrapper is shared with ").append(sharedWith.size()).append(" user(s):");
        for (String userId : sharedWith) {
            sb.append("\n- `").append(userId).append('`');
        }
        return sb.toString();
    }

    static String formatAvailable(List<AccessibleWrapper> wrappers) {
        if (wrappers.isEmpty()) {
            return "*Available Wrappers*" + DOUBLE_NEWLINE
                    + "No wrappers available." + DOUBLE_NEWLINE
                    + "Use `/register local` to set up your own wrapper.";
        }
        StringBuilder sb = new StringBuilder("*Available Wrappers*\n");
        for (AccessibleWrapper wrapper : wrappers) {
            if (wrapper.isOwn()) {
                sb.append("\n- *Your wrapper* (`").append(wrapper.getOwnerId()).append("`)");
            } else {
                String name = wrapper.getOwnerName() != null && !wrapper.getOwnerName().isEmpty()
                        ? wrapper.getOwnerName()
                        : wrapper.getOwnerId();
                sb.append("\n- ").append(name).append(" (`").append(wrapper.getOwnerId()).append("`)");
            }
        }
        sb.append(DOUBLE_NEWLINE).append("To use someone else's wrapper:\n")
                .append("`/task prompt:\"...\" target:<user-id>`");
        return sb.toString();
    }

    private static String describe(UserIdentity user) {
        return user.nameOrId() + " (`" + user.id() + "`)";
    }
}
