package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.domain.service.ApprovalCorrelator;
import me.golemcore.relay.testsupport.reply.RecordingReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ApproveCommandHandlerTest {

    private static final UserIdentity ALICE = new UserIdentity("42", "@alice");

    private ApprovalCorrelator approvalCorrelator;
    private ApproveCommandHandler handler;
    private RecordingReply reply;

    @BeforeEach
    void setUp() {
        approvalCorrelator = mock(ApprovalCorrelator.class);
        handler = new ApproveCommandHandler(approvalCorrelator);
        reply = new RecordingReply();
    }

    @Test
    void shouldRequireTaskIdAndOption() {
        handler.handle(invocation(Map.of("task_id", "t-1")), reply).join();

        assertEquals(ApproveCommandHandler.MSG_FIELDS_REQUIRED, reply.single(RecordingReply.RESPOND));
        verifyNoInteractions(approvalCorrelator);
    }

    @Test
    void shouldSubmitAnswerAndEditWithResult() {
        when(approvalCorrelator.submit(eq("t-1"), eq(ALICE), eq("yes"), isNull()))
                .thenReturn(CompletableFuture.completedFuture(RenderedReply.of("✅ *Approval Processed*")));

        handler.handle(invocation(Map.of("task_id", "t-1", "option", "yes")), reply).join();

        assertEquals(List.of(RecordingReply.ACK, RecordingReply.EDIT), reply.kinds());
        assertEquals(ApproveCommandHandler.ACK, reply.single(RecordingReply.ACK));
        assertEquals("✅ *Approval Processed*", reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldPassCustomResponse() {
        when(approvalCorrelator.submit(any(), any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(RenderedReply.of("done")));

        handler.handle(invocation(Map.of("task_id", "t-1", "option", "custom", "response", "try again")), reply)
                .join();

        verify(approvalCorrelator).submit("t-1", ALICE, "custom", "try again");
    }

    @Test
    void shouldReportFailure() {
        when(approvalCorrelator.submit(any(), any(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("No pending approval")));

        handler.handle(invocation(Map.of("task_id", "t-1", "option", "yes")), reply).join();

        assertEquals("❌ *Approval Failed*\n\n```\nNo pending approval\n```", reply.single(RecordingReply.EDIT));
    }

    private static CommandInvocation invocation(Map<String, String> options) {
        return CommandInvocation.builder()
                .command("approve")
                .actor(ALICE)
                .options(options)
                .build();
    }
}
