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
import me.golemcore.relay.domain.model.TaskView;
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
 * /status - full task snapshot; long output continues in follow-up messages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatusCommandHandler extends AbstractCommandHandler {

    static final String MSG_TASK_ID_REQUIRED = "❌ A `task_id` is required.";
    static final String ACK = "⏳ Fetching task status...";

    private static final String OPT_TASK_ID = "task_id";

    private static final CommandDefinition DEFINITION = CommandDefinition.simple(
            "status",
            "Check the status of a task",
            "/status task_id:<id>",
            List.of(CommandOption.freeText(OPT_TASK_ID, "The task ID to check", true)));

    private final BackendPort backendPort;
    private final TaskPresenter taskPresenter;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        Optional<String> taskId = invocation.option(OPT_TASK_ID);
        if (taskId.isEmpty()) {
            return respond(reply, MSG_TASK_ID_REQUIRED);
        }
        String userId = invocation.getActor().id();
        log.info("[Command] /status {} from {}", taskId.get(), userId);

        return acknowledgeThenEdit("status", reply, ACK,
                () -> backendPort.getTask(taskId.get(), userId),
                task -> taskPresenter.render(task, TaskView.STATUS),
                error -> failure("Failed to get task status", error));
    }
}
