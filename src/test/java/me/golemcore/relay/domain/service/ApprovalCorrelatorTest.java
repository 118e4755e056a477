package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.ApprovalRequest;
import me.golemcore.relay.domain.model.ApprovalSubmission;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.Task;
import me.golemcore.relay.domain.model.TaskStatus;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.port.outbound.BackendException;
import me.golemcore.relay.port.outbound.BackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApprovalCorrelatorTest {

    private static final UserIdentity ALICE = new UserIdentity("42", "@alice");

    private BackendPort backendPort;
    private ApprovalCorrelator correlator;

    @BeforeEach
    void setUp() {
        backendPort = mock(BackendPort.class);
        correlator = new ApprovalCorrelator(backendPort, new TaskPresenter());
    }

    @Test
    void shouldSubmitAnswerForCallerAndRenderResult() throws Exception {
        when(backendPort.submitApproval(eq("t-1"), eq("42"), any()))
                .thenReturn(CompletableFuture.completedFuture(task(TaskStatus.COMPLETED, null)));

        RenderedReply reply = correlator.submit("t-1", ALICE, "yes", null).get();

        ArgumentCaptor<ApprovalSubmission> captor = ArgumentCaptor.forClass(ApprovalSubmission.class);
        verify(backendPort).submitApproval(eq("t-1"), eq("42"), captor.capture());
        assertEquals("yes", captor.getValue().getOptionId());
        assertNull(captor.getValue().getCustomResponse());
        assertTrue(reply.content().startsWith("✅ *Approval Processed*"));
        assertFalse(reply.content().contains("Approval Required"));
    }

    @Test
    void shouldForwardCustomResponse() throws Exception {
        when(backendPort.submitApproval(eq("t-1"), eq("42"), any()))
                .thenReturn(CompletableFuture.completedFuture(task(TaskStatus.RUNNING, null)));

        correlator.submit("t-1", ALICE, "custom", "use staging instead").get();

        ArgumentCaptor<ApprovalSubmission> captor = ArgumentCaptor.forClass(ApprovalSubmission.class);
        verify(backendPort).submitApproval(eq("t-1"), eq("42"), captor.capture());
        assertEquals("use staging instead", captor.getValue().getCustomResponse());
    }

    @Test
    void shouldPresentChainedApprovalAsAdditional() throws Exception {
        Task chained = task(TaskStatus.NEEDS_APPROVAL,
                ApprovalRequest.builder().action("deploy").description("Deploy now?").build());
        when(backendPort.submitApproval(eq("t-1"), eq("42"), any()))
                .thenReturn(CompletableFuture.completedFuture(chained));

        RenderedReply reply = correlator.submit("t-1", ALICE, "yes", null).get();

        assertTrue(reply.content().contains("*Additional Approval Required:*\nDeploy now?"));
    }

    @Test
    void shouldPropagateBackendFailure() {
        when(backendPort.submitApproval(eq("t-9"), eq("42"), any()))
                .thenReturn(CompletableFuture.failedFuture(
                        BackendException.rejected("Approval submission failed", 404, "Task not found")));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> correlator.submit("t-9", ALICE, "yes", null).get());

        assertInstanceOf(BackendException.class, ex.getCause());
    }

    private static Task task(TaskStatus status, ApprovalRequest approval) {
        return Task.builder()
                .taskId("t-1")
                .sessionId("s-1")
                .status(status)
                .approvalRequest(approval)
                .build();
    }
}
