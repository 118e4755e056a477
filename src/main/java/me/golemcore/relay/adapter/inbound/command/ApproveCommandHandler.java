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
import me.golemcore.relay.domain.service.ApprovalCorrelator;
import me.golemcore.relay.port.inbound.InteractionReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /approve - answers a pending approval of a task.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApproveCommandHandler extends AbstractCommandHandler {

    static final String MSG_FIELDS_REQUIRED = "❌ Both `task_id` and `option` are required.";
    static final String ACK = "⏳ Processing approval...";

    private static final String OPT_TASK_ID = "task_id";
    private static final String OPT_OPTION = "option";
    private static final String OPT_RESPONSE = "response";

    private static final CommandDefinition DEFINITION = CommandDefinition.simple(
            "approve",
            "Respond to a task approval request",
            "/approve task_id:<id> option:<option> [custom response]",
            List.of(
                    CommandOption.text(OPT_TASK_ID, "The task ID requiring approval", true),
                    CommandOption.text(OPT_OPTION, "The approval option to select", true),
                    CommandOption.freeText(OPT_RESPONSE, "Optional custom response text", false)));

    private final ApprovalCorrelator approvalCorrelator;

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<Void> handle(CommandInvocation invocation, InteractionReply reply) {
        Optional<String> taskId = invocation.option(OPT_TASK_ID);
        Optional<String> option = invocation.option(OPT_OPTION);
        if (taskId.isEmpty() || option.isEmpty()) {
            return respond(reply, MSG_FIELDS_REQUIRED);
        }
        String response = invocation.option(OPT_RESPONSE).orElse(null);
        log.info("[Command] /approve {} option={} from {} (custom response: {})",
                taskId.get(), option.get(), invocation.getActor().id(), response != null);

        return acknowledgeThenEdit("approve", reply, ACK,
                () -> approvalCorrelator.submit(taskId.get(), invocation.getActor(), option.get(), response),
                rendered -> rendered,
                error -> failure("Approval Failed", error));
    }
}
