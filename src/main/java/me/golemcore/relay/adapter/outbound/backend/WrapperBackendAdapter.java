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

package me.golemcore.relay.adapter.outbound.backend;

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
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.BackendException;
import me.golemcore.relay.port.outbound.BackendPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Backend adapter for the wrapper service (or the orchestrator in front of it)
 * speaking its JSON REST API.
 *
 * <p>
 * Endpoints, relative to {@code relay.backend.url}:
 * <ul>
 * <li>GET /api/v1/health
 * <li>POST /api/v1/tasks, GET /api/v1/tasks/{id}, POST /api/v1/tasks/{id}/approve
 * <li>GET /api/v1/sessions, DELETE /api/v1/sessions/{id}
 * <li>GET /api/v1/projects/{user}, POST /api/v1/projects, DELETE
 * /api/v1/projects/{user}/{name}
 * <li>GET /api/v1/users/{id}, POST /api/v1/users/register-local, DELETE
 * /api/v1/users/{id}/local, POST /api/v1/users/enable-cluster, POST
 * /api/v1/users/{id}/set-mode
 * <li>POST|GET /api/v1/users/{owner}/share, DELETE
 * /api/v1/users/{owner}/share/{target}, GET
 * /api/v1/users/{id}/accessible-wrappers
 * </ul>
 *
 * <p>
 * Calls are asynchronous ({@link Call#enqueue}) and never retried. Connection
 * failures, non-success statuses (with the raw body) and unparseable bodies
 * all complete the returned future with a {@link BackendException}.
 *
 * @see me.golemcore.relay.port.outbound.BackendPort
 */
@Component
@Slf4j
public class WrapperBackendAdapter implements BackendPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_PREFIX = "api/v1";
    private static final String USER_QUERY = "discord_user_id";
    private static final String USERS = "users";
    private static final String SHARE = "share";

    private static final Operation HEALTH = new Operation(
            "Failed to connect to wrapper service", "Health check failed", "Failed to parse health response");
    private static final Operation SUBMIT_TASK = new Operation(
            "Failed to submit task", "Task submission failed", "Failed to parse task response");
    private static final Operation GET_TASK = new Operation(
            "Failed to get task", "Failed to get task", "Failed to parse task response");
    private static final Operation SUBMIT_APPROVAL = new Operation(
            "Failed to submit approval", "Approval submission failed", "Failed to parse approval response");
    private static final Operation LIST_SESSIONS = new Operation(
            "Failed to list sessions", "Failed to list sessions", "Failed to parse sessions response");
    private static final Operation TERMINATE_SESSION = new Operation(
            "Failed to terminate session", "Session termination failed", null);
    private static final Operation LIST_PROJECTS = new Operation(
            "Failed to list projects", "Failed to list projects", "Failed to parse projects response");
    private static final Operation ADD_PROJECT = new Operation(
            "Failed to add project", "Failed to add project", "Failed to parse project response");
    private static final Operation REMOVE_PROJECT = new Operation(
            "Failed to remove project", "Failed to remove project", null);
    private static final Operation GET_USER = new Operation(
            "Failed to get user", "Failed to get user", "Failed to parse user response");
    private static final Operation REGISTER_LOCAL = new Operation(
            "Failed to register local wrapper", "Failed to register local wrapper", "Failed to parse user response");
    private static final Operation UNREGISTER_LOCAL = new Operation(
            "Failed to unregister local wrapper", "Failed to unregister local wrapper", null);
    private static final Operation ENABLE_CLUSTER = new Operation(
            "Failed to enable cluster access", "Failed to enable cluster access", "Failed to parse user response");
    private static final Operation SET_MODE = new Operation(
            "Failed to set user mode", "Failed to set user mode", "Failed to parse user response");
    private static final Operation SHARE_WITH = new Operation(
            "Failed to share wrapper", "Failed to share wrapper", "Failed to parse share response");
    private static final Operation UNSHARE_WITH = new Operation(
            "Failed to unshare wrapper", "Failed to unshare wrapper", "Failed to parse unshare response");
    private static final Operation LIST_SHARED = new Operation(
            "Failed to list shared users", "Failed to list shared users", "Failed to parse share list response");
    private static final Operation LIST_ACCESSIBLE = new Operation(
            "Failed to list accessible wrappers", "Failed to list accessible wrappers",
            "Failed to parse accessible wrappers response");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;

    public WrapperBackendAdapter(RelayProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = parseBaseUrl(properties.getBackend().getUrl());
        log.info("[Backend] Using wrapper service at {}", baseUrl);
    }

    @Override
    public CompletableFuture<HealthStatus> health() {
        return execute(get(url("health")), HEALTH, type(HealthStatus.class));
    }

    @Override
    public CompletableFuture<Task> submitTask(TaskRequest request) {
        return sendJson(url("tasks"), "POST", request, SUBMIT_TASK, type(Task.class));
    }

    @Override
    public CompletableFuture<Task> getTask(String taskId, String userId) {
        HttpUrl url = url("tasks").newBuilder()
                .addPathSegment(taskId)
                .addQueryParameter(USER_QUERY, userId)
                .build();
        return execute(get(url), GET_TASK, type(Task.class));
    }

    @Override
    public CompletableFuture<Task> submitApproval(String taskId, String userId, ApprovalSubmission submission) {
        HttpUrl url = url("tasks").newBuilder()
                .addPathSegment(taskId)
                .addPathSegment("approve")
                .addQueryParameter(USER_QUERY, userId)
                .build();
        return sendJson(url, "POST", submission, SUBMIT_APPROVAL, type(Task.class));
    }

    @Override
    public CompletableFuture<List<SessionInfo>> listSessions() {
        return execute(get(url("sessions")), LIST_SESSIONS, listOf(SessionInfo.class));
    }

    @Override
    public CompletableFuture<Void> terminateSession(String sessionId) {
        HttpUrl url = url("sessions").newBuilder().addPathSegment(sessionId).build();
        return executeWithoutBody(delete(url), TERMINATE_SESSION);
    }

    @Override
    public CompletableFuture<List<Project>> listProjects(String userId) {
        HttpUrl url = url("projects").newBuilder().addPathSegment(userId).build();
        return execute(get(url), LIST_PROJECTS, listOf(Project.class));
    }

    @Override
    public CompletableFuture<Project> addProject(ProjectRequest request) {
        return sendJson(url("projects"), "POST", request, ADD_PROJECT, type(Project.class));
    }

    @Override
    public CompletableFuture<Void> removeProject(String userId, String name) {
        HttpUrl url = url("projects").newBuilder()
                .addPathSegment(userId)
                .addPathSegment(name)
                .build();
        return executeWithoutBody(delete(url), REMOVE_PROJECT);
    }

    @Override
    public CompletableFuture<RegisteredUser> getUser(String userId) {
        return execute(get(userUrl(userId)), GET_USER, type(RegisteredUser.class));
    }

    @Override
    public CompletableFuture<RegisteredUser> registerLocal(RegisterLocalRequest request) {
        HttpUrl url = url(USERS).newBuilder().addPathSegment("register-local").build();
        return sendJson(url, "POST", request, REGISTER_LOCAL, type(RegisteredUser.class));
    }

    @Override
    public CompletableFuture<Void> unregisterLocal(String userId) {
        HttpUrl url = userUrl(userId).newBuilder().addPathSegment("local").build();
        return executeWithoutBody(delete(url), UNREGISTER_LOCAL);
    }

    @Override
    public CompletableFuture<RegisteredUser> enableCluster(EnableClusterRequest request) {
        HttpUrl url = url(USERS).newBuilder().addPathSegment("enable-cluster").build();
        return sendJson(url, "POST", request, ENABLE_CLUSTER, type(RegisteredUser.class));
    }

    @Override
    public CompletableFuture<RegisteredUser> setMode(String userId, ExecutionMode mode) {
        HttpUrl url = userUrl(userId).newBuilder().addPathSegment("set-mode").build();
        return sendJson(url, "POST", new SetModeRequest(mode), SET_MODE, type(RegisteredUser.class));
    }

    @Override
    public CompletableFuture<List<String>> share(String ownerId, String targetId) {
        HttpUrl url = userUrl(ownerId).newBuilder().addPathSegment(SHARE).build();
        return this.<ShareListResponse>sendJson(url, "POST", new ShareRequest(targetId), SHARE_WITH,
                type(ShareListResponse.class))
                .thenApply(ShareListResponse::sharedWithOrEmpty);
    }

    @Override
    public CompletableFuture<List<String>> unshare(String ownerId, String targetId) {
        HttpUrl url = userUrl(ownerId).newBuilder()
                .addPathSegment(SHARE)
                .addPathSegment(targetId)
                .build();
        return this.<ShareListResponse>execute(delete(url), UNSHARE_WITH, type(ShareListResponse.class))
                .thenApply(ShareListResponse::sharedWithOrEmpty);
    }

    @Override
    public CompletableFuture<List<String>> listShared(String ownerId) {
        HttpUrl url = userUrl(ownerId).newBuilder().addPathSegment(SHARE).build();
        return this.<ShareListResponse>execute(get(url), LIST_SHARED, type(ShareListResponse.class))
                .thenApply(ShareListResponse::sharedWithOrEmpty);
    }

    @Override
    public CompletableFuture<List<AccessibleWrapper>> listAccessibleWrappers(String userId) {
        HttpUrl url = userUrl(userId).newBuilder().addPathSegment("accessible-wrappers").build();
        return this.<AccessibleWrappersResponse>execute(get(url), LIST_ACCESSIBLE,
                type(AccessibleWrappersResponse.class))
                .thenApply(AccessibleWrappersResponse::wrappersOrEmpty);
    }

    // ===== Request plumbing =====

    private <T> CompletableFuture<T> sendJson(HttpUrl url, String method, Object payload, Operation operation,
            JavaType responseType) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(BackendException.decode(operation.failure(), e));
        }
        Request request = new Request.Builder()
                .url(url)
                .method(method, RequestBody.create(body, JSON))
                .build();
        return execute(request, operation, responseType);
    }

    private <T> CompletableFuture<T> execute(Request request, Operation operation, JavaType responseType) {
        return call(request, operation).thenApply(responseBody -> parse(responseBody, operation, responseType));
    }

    private CompletableFuture<Void> executeWithoutBody(Request request, Operation operation) {
        return call(request, operation).thenApply(ignored -> null);
    }

    private CompletableFuture<String> call(Request request, Operation operation) {
        CompletableFuture<String> future = new CompletableFuture<>();
        log.debug("[Backend] {} {}", request.method(), request.url());

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(BackendException.transport(operation.failure(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    String text = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(
                                BackendException.rejected(operation.rejection(), response.code(), text));
                        return;
                    }
                    future.complete(text);
                } catch (IOException e) {
                    future.completeExceptionally(BackendException.transport(operation.failure(), e));
                }
            }
        });
        return future;
    }

    private <T> T parse(String body, Operation operation, JavaType responseType) {
        if (body == null || body.isBlank()) {
            throw BackendException.decode(operation.parse(), new IOException("empty response body"));
        }
        try {
            return objectMapper.readValue(body, responseType);
        } catch (JsonProcessingException e) {
            throw BackendException.decode(operation.parse(), e);
        }
    }

    private Request get(HttpUrl url) {
        return new Request.Builder().url(url).get().build();
    }

    private Request delete(HttpUrl url) {
        return new Request.Builder().url(url).delete().build();
    }

    private HttpUrl url(String resource) {
        return baseUrl.newBuilder()
                .addPathSegments(API_PREFIX)
                .addPathSegment(resource)
                .build();
    }

    private HttpUrl userUrl(String userId) {
        return url(USERS).newBuilder().addPathSegment(userId).build();
    }

    private JavaType type(Class<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    private JavaType listOf(Class<?> elementType) {
        return objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    static HttpUrl parseBaseUrl(String url) {
        String trimmed = url != null ? url.trim() : "";
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        HttpUrl parsed = HttpUrl.parse(trimmed);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid backend URL: " + url);
        }
        return parsed;
    }

    /**
     * Message prefixes for one backend call: connection failure, non-success
     * status and parse failure.
     */
    private record Operation(String failure, String rejection, String parse) {
    }

    // Request/response DTOs private to the wire format
    record SetModeRequest(ExecutionMode mode) {
    }

    record ShareRequest(@JsonProperty("target_user_id") String targetUserId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ShareListResponse(@JsonProperty("shared_with") List<String> sharedWith) {
        List<String> sharedWithOrEmpty() {
            return sharedWith != null ? sharedWith : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AccessibleWrappersResponse(@JsonProperty("wrappers") List<AccessibleWrapper> wrappers) {
        List<AccessibleWrapper> wrappersOrEmpty() {
            return wrappers != null ? wrappers : List.of();
        }
    }
}
