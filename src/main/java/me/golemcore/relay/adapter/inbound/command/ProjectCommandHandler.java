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
import me.golemcore.relay.domain.model.Project;
import me.golemcore.relay.domain.model.ProjectRequest;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.SubcommandDefinition;
import me.golemcore.relay.port.inbound.InteractionReply;
import me.golemcore.relay.port.outbound.BackendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /project list|add|remove - the caller's project registry. Projects are
 * always scoped to the acting user.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectCommandHandler extends AbstractCommandHandler {

    static final String MSG_UNKNOWN_SUBCOMMAND =
            "Unknown subcommand. Use `/project list`, `/project add`, or `/project remove`.";
    static final String MSG_NAME_AND_PATH_REQUIRED = "❌ Both `name` and `path` are required.";
    static final String MSG_NAME_REQUIRED = "❌ Project `name` is required.";

    private static final String SUBCMD_LIST = "list";
    private static final String SUBCMD_ADD = "add";
    private static final String SUBCMD_REMOVE = "remove";
    private static final String OPT_NAME = "name";
    private static final String OPT_PATH = "path";
    private static final String OPT_DESCRIPTION = "description";
    private static final String HEADING = "*Your Projects:*\n";

    private static final CommandDefinition DEFINITION = CommandDefinition.grouped(
            "project",
            "Manage your registered projects",
            "/project list | /project add name:<name> path:<path> [description] | /project remove <name>",
            List.of(
                    new SubcommandDefinition(SUBCMD_LIST, "List your registered projects", List.of()),
                    new SubcommandDefinition(SUBCMD_ADD, "Add a new project", List.of(
                            CommandOption.text(OPT_NAME, "Unique project name/alias (e.g., 'my-api')", true),
                            CommandOption.text(OPT_PATH, "Absolute path to the project directory", true),
                            CommandOption.freeText(OPT_DESCRIPTION, "Optional project description", false))),
                    new SubcommandDefinition(SUBCMD_REMOVE, "Remove a project", List.of(
                            CommandOption.freeText(OPT_NAME, "Project name to remove", true)))),
            SUBCMD_LIST);

    private final BackendPort backendPort;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        String subcommand = invocation.getSubcommand() != null ? invocation.getSubcommand() : SUBCMD_LIST;
        String userId = invocation.getActor().id();
        log.info("[Command] /project {} from {}", subcommand, userId);

        return switch (subcommand) {
        case SUBCMD_LIST -> handleList(userId, reply);
        case SUBCMD_ADD -> handleAdd(invocation, userId, reply);
        case SUBCMD_REMOVE -> handleRemove(invocation, userId, reply);
        default -> respond(reply, MSG_UNKNOWN_SUBCOMMAND);
        };
    }

    private CompletableFuture<Void> handleList(String userId, InteractionReply reply) {
        return acknowledgeThenEdit("project list", reply, "⏳ Loading your projects...",
                () -> backendPort.listProjects(userId),
                projects -> RenderedReply.of(formatProjects(projects)),
                error -> failure("Failed to list projects", error));
    }

    private CompletableFuture<Void> handleAdd(CommandInvocation invocation, String userId, InteractionReply reply) {
        Optional<String> name = invocation.option(OPT_NAME);
        Optional<String> path = invocation.option(OPT_PATH);
        if (name.isEmpty() || path.isEmpty()) {
            return respond(reply, MSG_NAME_AND_PATH_REQUIRED);
        }

        ProjectRequest request = ProjectRequest.builder()
                .name(name.get())
                .path(path.get())
                .description(invocation.option(OPT_DESCRIPTION).orElse(null))
                .discordUserId(userId)
                .build();

        return acknowledgeThenEdit("project add", reply, "⏳ Adding project...",
                () -> backendPort.addProject(request),
                project -> RenderedReply.of("✅ *Project Added*" + DOUBLE_NEWLINE
                        + "*Name:* `" + project.getName() + "`\n"
                        + "*Path:* `" + project.getPath() + "`" + DOUBLE_NEWLINE
                        + "Use `/task prompt:\"...\" project:" + project.getName()
                        + "` to work on this project."),
                error -> failure("Failed to add project", error));
    }

    private CompletableFuture<Void> handleRemove(CommandInvocation invocation, String userId,
            InteractionReply reply) {
        Optional<String> name = invocation.option(OPT_NAME);
        if (name.isEmpty()) {
            return respond(reply, MSG_NAME_REQUIRED);
        }

        return acknowledgeThenEdit("project remove", reply, "⏳ Removing project...",
                () -> backendPort.removeProject(userId, name.get()),
                ignored -> RenderedReply.of("✅ Project `" + name.get() + "` has been removed."),
                error -> failure("Failed to remove project", error));
    }

    static String formatProjects(List<Project> projects) {
        if (projects.isEmpty()) {
            return HEADING + "\nNo projects registered." + DOUBLE_NEWLINE
                    + "Use `/project add name:<name> path:<path>` to add one.";
        }
        StringBuilder sb = new StringBuilder(HEADING);
        for (Project project : projects) {
            sb.append("\n`").append(project.getName()).append("` → `").append(project.getPath()).append('`');
            if (project.getDescription() != null && !project.getDescription().isEmpty()) {
                sb.append(" - ").append(project.getDescription());
            }
        }
        return sb.toString();
    }
}
