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

package me.golemcore.relay.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ApprovalSubmission;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.TaskView;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.port.outbound.BackendPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Threads an approval answer back to its task.
 *
 * <p>
 * The task id supplied by the caller is the only correlation key; the backend
 * decides whether that task still has a pending approval. The task returned by
 * the backend is rendered in {@link TaskView#APPROVAL}, where any approval it
 * carries is presented as an additional one with its own options.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalCorrelator {

    private final BackendPort backendPort;
    private final TaskPresenter taskPresenter;

    public CompletableFuture<RenderedReply> submit(String taskId, UserIdentity actor, String optionId,
            String customResponse) {
        ApprovalSubmission submission = ApprovalSubmission.builder()
                .optionId(optionId)
                .customResponse(customResponse)
                .build();

        return backendPort.submitApproval(taskId, actor.id(), submission)
                .thenApply(task -> {
                    if (task.hasPendingApproval()) {
                        log.info("[Approval] Task {} requested another approval: {}",
                                task.getTaskId(), task.getApprovalRequest().getAction());
                    } else {
                        log.debug("[Approval] Task {} moved to {}", task.getTaskId(), task.getStatus());
                    }
                    return taskPresenter.render(task, TaskView.APPROVAL);
                });
    }
}
