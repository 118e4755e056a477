package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.ExecutionMode;
import me.golemcore.relay.domain.model.Task;
import me.golemcore.relay.domain.model.TaskRequest;
import me.golemcore.relay.domain.model.TaskStatus;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.domain.service.AccessResolver;
import me.golemcore.relay.domain.service.TaskPresenter;
import me.golemcore.relay.port.outbound.BackendException;
import me.golemcore.relay.port.outbound.BackendPort;
import me.golemcore.relay.testsupport.reply.RecordingReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TaskCommandHandlerTest {

    private static final UserIdentity ALICE = new UserIdentity("42", "@alice");

    private BackendPort backendPort;
    private TaskCommandHandler handler;
    private RecordingReply reply;

    @BeforeEach
    void setUp() {
        backendPort = mock(BackendPort.class);
        handler = new TaskCommandHandler(backendPort, new TaskPresenter(), new AccessResolver());
        reply = new RecordingReply();
    }

    @Test
    void shouldRequirePromptWithoutCallingBackend() {
        handler.handle(invocation(Map.of()), reply).join();

        assertEquals(List.of(RecordingReply.RESPOND), reply.kinds());
        assertEquals(TaskCommandHandler.MSG_PROMPT_REQUIRED, reply.single(RecordingReply.RESPOND));
        verifyNoInteractions(backendPort);
    }

    @Test
    void shouldAcknowledgeThenEditWithRenderedTask() {
        when(backendPort.submitTask(any())).thenReturn(CompletableFuture.completedFuture(Task.builder()
                .taskId("t-1").sessionId("s-1").status(TaskStatus.COMPLETED).output("hello").build()));

        handler.handle(invocation(Map.of("prompt", "say hello")), reply).join();

        assertEquals(List.of(RecordingReply.ACK, RecordingReply.EDIT), reply.kinds());
        assertEquals("Processing your task...", reply.single(RecordingReply.ACK));
        assertTrue(reply.single(RecordingReply.EDIT).startsWith("✅ *Task Completed*"));
    }

    @Test
    void shouldSendCallerAsActorAndTargetAsRequestedOwner() {
        when(backendPort.submitTask(any())).thenReturn(CompletableFuture.completedFuture(Task.builder()
                .taskId("t-1").sessionId("s-1").status(TaskStatus.PENDING).build()));
        CommandInvocation invocation = invocation(Map.of(
                "prompt", "build it", "project", "api", "target", "7", "mode", "cluster", "session", "s-0"))
                .toBuilder()
                .resolvedUsers(Map.of("7", new UserIdentity("7", "Bob")))
                .build();

        handler.handle(invocation, reply).join();

        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(backendPort).submitTask(captor.capture());
        TaskRequest request = captor.getValue();
        assertEquals("build it", request.getPrompt());
        assertEquals("42", request.getDiscordUserId());
        assertEquals("7", request.getTargetUserId());
        assertEquals("api", request.getProject());
        assertEquals("s-0", request.getSessionId());
        assertEquals(ExecutionMode.CLUSTER, request.getMode());
        assertEquals("Processing your task on `api` via Bob (cluster)...", reply.single(RecordingReply.ACK));
    }

    @Test
    void shouldLeaveTargetUnsetWhenNotRequested() {
        when(backendPort.submitTask(any())).thenReturn(CompletableFuture.completedFuture(Task.builder()
                .taskId("t-1").sessionId("s-1").status(TaskStatus.RUNNING).build()));

        handler.handle(invocation(Map.of("prompt", "x")), reply).join();

        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(backendPort).submitTask(captor.capture());
        assertNull(captor.getValue().getTargetUserId());
        assertNull(captor.getValue().getMode());
    }

    @Test
    void shouldAddRegistrationHintWhenUserUnknown() {
        when(backendPort.submitTask(any())).thenReturn(CompletableFuture.failedFuture(
                BackendException.rejected("Task submission failed", 404, "User not found")));

        handler.handle(invocation(Map.of("prompt", "x")), reply).join();

        String edit = reply.single(RecordingReply.EDIT);
        assertTrue(edit.startsWith("❌ *Task Failed*\n\n```\nTask submission failed (HTTP 404): User not found\n```"));
        assertTrue(edit.endsWith(AccessResolver.REGISTRATION_HINT));
    }

    @Test
    void shouldNotHintOnConnectionFailure() {
        when(backendPort.submitTask(any())).thenReturn(CompletableFuture.failedFuture(
                BackendException.transport("Failed to submit task", new IOException("Connection refused"))));

        handler.handle(invocation(Map.of("prompt", "x")), reply).join();

        assertEquals("❌ *Task Failed*\n\n```\nFailed to submit task: Connection refused\n```",
                reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldBuildAcknowledgementFromParts() {
        assertEquals("Processing your task...",
                TaskCommandHandler.acknowledgement(Optional.empty(), Optional.empty(), null));
        assertEquals("Processing your task via 7 (local)...",
                TaskCommandHandler.acknowledgement(Optional.empty(), Optional.of(UserIdentity.of("7")),
                        ExecutionMode.LOCAL));
    }

    private static CommandInvocation invocation(Map<String, String> options) {
        return CommandInvocation.builder()
                .command("task")
                .actor(ALICE)
                .chatId("100")
                .channelType("telegram")
                .options(options)
                .build();
    }
}
