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

package me.golemcore.relay.port.outbound;

import me.golemcore.relay.domain.model.AccessibleWrapper;
import me.golemcore.relay.domain.model.ApprovalSubmission;
import me.golemcore.relay.domain.model.EnableClusterRequest;
import me.golemcore.relay.domain.model.ExecutionMode;
import me.golemcore.relay.domain.model.HealthStatus;
import me.golemcore.relay.domain.model.Project;
import me.golemcore.relay.domain.model.ProjectRequest;
import me.golemcore.relay.domain.model.RegisterLocalRequest;
import me.golemcore.relay.domain.model.RegisteredUser;
import me.golemcore.relay.domain.model.SessionInfo;
import me.golemcore.relay.domain.model.Task;
import me.golemcore.relay.domain.model.TaskRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the task execution backend ("wrapper" service / orchestrator).
 *
 * <p>
 * One method per backend capability. Every returned future either completes
 * with the parsed response or fails with {@link BackendException}, whether the
 * cause was the connection, a non-success status or an unparseable body.
 * Nothing is retried.
 */
public interface BackendPort {

    CompletableFuture<HealthStatus> health();

    CompletableFuture<Task> submitTask(TaskRequest request);

    /**
     * Fetches a task. {@code userId} routes the request to the right user's
     * wrapper.
     */
    CompletableFuture<Task> getTask(String taskId, String userId);

    CompletableFuture<Task> submitApproval(String taskId, String userId, ApprovalSubmission submission);

    CompletableFuture<List<SessionInfo>> listSessions();

    CompletableFuture<Void> terminateSession(String sessionId);

    CompletableFuture<List<Project>> listProjects(String userId);

    CompletableFuture<Project> addProject(ProjectRequest request);

    CompletableFuture<Void> removeProject(String userId, String name);

    CompletableFuture<RegisteredUser> getUser(String userId);

    CompletableFuture<RegisteredUser> registerLocal(RegisterLocalRequest request);

    CompletableFuture<Void> unregisterLocal(String userId);

    CompletableFuture<RegisteredUser> enableCluster(EnableClusterRequest request);

    CompletableFuture<RegisteredUser> setMode(String userId, ExecutionMode mode);

    /**
     * Grants {@code targetId} access to {@code ownerId}'s wrapper.
     *
     * @return ids the owner now shares with
     */
    CompletableFuture<List<String>> share(String ownerId, String targetId);

    /**
     * @return ids the owner still shares with
     */
    CompletableFuture<List<String>> unshare(String ownerId, String targetId);

    CompletableFuture<List<String>> listShared(String ownerId);

    CompletableFuture<List<AccessibleWrapper>> listAccessibleWrappers(String userId);
}
