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
import me.golemcore.relay.domain.model.ExecutionMode;
import me.golemcore.relay.domain.model.TaskRequest;
import me.golemcore.relay.domain.model.TaskView;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.domain.service.AccessResolver;
import me.golemcore.relay.domain.service.AccessResolver.ExecutionIdentity;
import me.golemcore.relay.domain.service.TaskPresenter;
import me.golemcore.relay.port.inbound.InteractionReply;
import me.golemcore.relay.port.outbound.BackendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /task - submits a prompt to the caller's backend, or to a target user's when
 * one is given.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskCommandHandler extends AbstractCommandHandler {

    static final String MSG_PROMPT_REQUIRED = "❌ A `prompt` is required.";

    private static final String OPT_PROMPT = "prompt";
    private static final String OPT_PROJECT = "project";
    private static final String OPT_TARGET = "target";
    private static final String OPT_MODE = "mode";
    private static final String OPT_SESSION = "session";

    private static final CommandDefinition DEFINITION = CommandDefinition.simple(
            "task",
            "Submit a task to the execution backend",
            "/task <prompt> [project:<name>] [target:<user>] [mode:local|cluster] [session:<id>]",
            List.of(
                    CommandOption.freeText(OPT_PROMPT, "The task/prompt to run", true),
                    CommandOption.text(OPT_PROJECT,
                            "Project name to work on (use /project list to see available)", false),
                    CommandOption.user(OPT_TARGET,
                            "Use another user's wrapper (requires their permission via /share)", false),
                    CommandOption.choice(OPT_MODE, "Where to run: local (your machine) or cluster",
                            List.of("local", "cluster")),
                    CommandOption.text(OPT_SESSION, "Optional session ID to continue a previous session", false)));

    private final BackendPort backendPort;
    private final TaskPresenter taskPresenter;
    private final AccessResolver accessResolver;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        Optional<String> prompt = invocation.option(OPT_PROMPT);
        if (prompt.isEmpty()) {
            return respond(reply, MSG_PROMPT_REQUIRED);
        }

        ExecutionIdentity identity = accessResolver.resolve(invocation, OPT_TARGET);
        Optional<String> project = invocation.option(OPT_PROJECT);
        ExecutionMode mode = invocation.option(OPT_MODE).map(ExecutionMode::fromUserInput).orElse(null);
        Optional<UserIdentity> target = identity.target();

        log.info("[Command] /task from {} (target={}, project={}, mode={})",
                identity.actor().id(), target.map(UserIdentity::id).orElse(null),
                project.orElse(null), mode);

        TaskRequest request = TaskRequest.builder()
                .prompt(prompt.get())
                .project(project.orElse(null))
                .sessionId(invocation.option(OPT_SESSION).orElse(null))
                .discordUserId(identity.actor().id())
                .targetUserId(target.map(UserIdentity::id).orElse(null))
                .mode(mode)
                .build();

        return acknowledgeThenEdit("task", reply,
                acknowledgement(project, target, mode),
                () -> backendPort.submitTask(request),
                task -> taskPresenter.render(task, TaskView.SUBMISSION),
                error -> {
                    String message = errorMessage(error);
                    return failure("Task Failed", error) + accessResolver.registrationHint(message);
                });
    }

    static String acknowledgement(Optional<String> project, Optional<UserIdentity> target, ExecutionMode mode) {
        StringBuilder sb = new StringBuilder("Processing your task");
        project.ifPresent(name -> sb.append(" on `").append(name).append('`'));
        target.ifPresent(user -> sb.append(" via ").append(user.nameOrId()));
        if (mode != null) {
            sb.append(" (").append(mode.getCode()).append(')');
        }
        return sb.append("...").toString();
    }
}
