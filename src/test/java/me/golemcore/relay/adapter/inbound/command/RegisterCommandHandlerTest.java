package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.EnableClusterRequest;
import me.golemcore.relay.domain.model.ExecutionMode;
import me.golemcore.relay.domain.model.RegisterLocalRequest;
import me.golemcore.relay.domain.model.RegisteredUser;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.port.outbound.BackendException;
import me.golemcore.relay.port.outbound.BackendPort;
import me.golemcore.relay.security.AllowlistValidator;
import me.golemcore.relay.testsupport.reply.RecordingReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RegisterCommandHandlerTest {

    private static final UserIdentity ALICE = new UserIdentity("42", "@alice");

    private BackendPort backendPort;
    private AllowlistValidator allowlistValidator;
    private RegisterCommandHandler handler;
    private RecordingReply reply;

    @BeforeEach
    void setUp() {
        backendPort = mock(BackendPort.class);
        allowlistValidator = mock(AllowlistValidator.class);
        handler = new RegisterCommandHandler(backendPort, allowlistValidator);
        reply = new RecordingReply();
    }

    @Test
    void shouldRegisterLocalWrapperForCaller() {
        when(backendPort.registerLocal(any())).thenReturn(CompletableFuture.completedFuture(RegisteredUser.builder()
                .discordId("42").localWrapperUrl("http://10.0.0.5:8000").defaultMode("local").build()));

        handler.handle(invocation("local", Map.of("url", "http://10.0.0.5:8000")), reply).join();

        ArgumentCaptor<RegisterLocalRequest> captor = ArgumentCaptor.forClass(RegisterLocalRequest.class);
        verify(backendPort).registerLocal(captor.capture());
        assertEquals("42", captor.getValue().getDiscordId());
        assertEquals("@alice", captor.getValue().getDiscordName());
        assertTrue(reply.single(RecordingReply.EDIT).startsWith("✅ *Local Wrapper Registered*"));
        assertTrue(reply.single(RecordingReply.EDIT).contains("*URL:* `http://10.0.0.5:8000`"));
    }

    @Test
    void shouldRequireUrl() {
        handler.handle(invocation("local", Map.of()), reply).join();

        assertEquals(RegisterCommandHandler.MSG_URL_REQUIRED, reply.single(RecordingReply.RESPOND));
        verifyNoInteractions(backendPort);
    }

    @Test
    void shouldShowStatusByDefault() {
        when(backendPort.getUser("42")).thenReturn(CompletableFuture.completedFuture(RegisteredUser.builder()
                .discordId("42").clusterEnabled(true).clusterStoragePath("/data/42").build()));

        handler.handle(invocation(null, Map.of()), reply).join();

        String edit = reply.single(RecordingReply.EDIT);
        assertTrue(edit.startsWith("*Your Registration Status*"));
        assertTrue(edit.contains("*Local Wrapper:* ❌ Not registered"));
        assertTrue(edit.contains("*Cluster Access:* ✅ Enabled (storage: `/data/42`)"));
        assertTrue(edit.contains("*Default Mode:* `local`"));
        assertTrue(edit.contains("*Last Seen:* never"));
    }

    @Test
    void shouldExplainRegistrationWhenUserUnknown() {
        when(backendPort.getUser("42")).thenReturn(CompletableFuture.failedFuture(
                BackendException.rejected("Failed to get user", 404, "{\"detail\":\"User not found\"}")));

        handler.handle(invocation("status", Map.of()), reply).join();

        assertEquals(RegisterCommandHandler.MSG_NOT_REGISTERED, reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldReportOtherStatusFailures() {
        when(backendPort.getUser("42")).thenReturn(CompletableFuture.failedFuture(
                BackendException.transport("Failed to get user", new IOException("timeout"))));

        handler.handle(invocation("status", Map.of()), reply).join();

        assertTrue(reply.single(RecordingReply.EDIT).startsWith("❌ *Failed to get registration status*"));
    }

    @Test
    void shouldSetModeLeniently() {
        when(backendPort.setMode("42", ExecutionMode.CLUSTER)).thenReturn(CompletableFuture.completedFuture(
                RegisteredUser.builder().discordId("42").defaultMode("cluster").build()));

        handler.handle(invocation("mode", Map.of("default", "CLUSTER")), reply).join();

        assertEquals("✅ Default mode set to *cluster*\n\nYour tasks will now run on: the cluster",
                reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldHintRegistrationWhenModeFails() {
        when(backendPort.setMode("42", ExecutionMode.LOCAL)).thenReturn(CompletableFuture.failedFuture(
                BackendException.rejected("Failed to set user mode", 404, "User not found")));

        handler.handle(invocation("mode", Map.of()), reply).join();

        assertTrue(reply.single(RecordingReply.EDIT).endsWith(RegisterCommandHandler.MSG_REGISTER_FIRST));
    }

    @Test
    void shouldUnregister() {
        when(backendPort.unregisterLocal("42")).thenReturn(CompletableFuture.completedFuture(null));

        handler.handle(invocation("unregister", Map.of()), reply).join();

        assertEquals("✅ Local wrapper unregistered.", reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldRefuseClusterForNonAdmin() {
        when(allowlistValidator.isAdmin("42")).thenReturn(false);

        handler.handle(invocation("cluster", Map.of("user", "7")), reply).join();

        assertEquals(RegisterCommandHandler.MSG_ADMIN_ONLY, reply.single(RecordingReply.RESPOND));
        verifyNoInteractions(backendPort);
    }

    @Test
    void shouldEnableClusterForNamedUserWhenAdmin() {
        when(allowlistValidator.isAdmin("42")).thenReturn(true);
        when(backendPort.enableCluster(any())).thenReturn(CompletableFuture.completedFuture(
                RegisteredUser.builder().discordId("7").build()));
        CommandInvocation invocation = invocation("cluster", Map.of("user", "7", "storage_path", "/data/7"))
                .toBuilder()
                .resolvedUsers(Map.of("7", new UserIdentity("7", "Bob")))
                .build();

        handler.handle(invocation, reply).join();

        ArgumentCaptor<EnableClusterRequest> captor = ArgumentCaptor.forClass(EnableClusterRequest.class);
        verify(backendPort).enableCluster(captor.capture());
        assertEquals("7", captor.getValue().getDiscordId());
        assertEquals("Bob", captor.getValue().getDiscordName());
        assertEquals("/data/7", captor.getValue().getStoragePath());
        assertEquals("✅ *Cluster Access Enabled*\n\n*User:* `7`\n*Storage:* `default`",
                reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldRequireUserForCluster() {
        when(allowlistValidator.isAdmin("42")).thenReturn(true);

        handler.handle(invocation("cluster", Map.of()), reply).join();

        assertEquals(RegisterCommandHandler.MSG_USER_REQUIRED, reply.single(RecordingReply.RESPOND));
    }

    @Test
    void shouldRejectUnknownSubcommand() {
        handler.handle(invocation("remote", Map.of()), reply).join();

        assertEquals(RegisterCommandHandler.MSG_UNKNOWN_SUBCOMMAND, reply.single(RecordingReply.RESPOND));
    }

    private static CommandInvocation invocation(String subcommand, Map<String, String> options) {
        return CommandInvocation.builder()
                .command("register")
                .subcommand(subcommand)
                .actor(ALICE)
                .options(options)
                .build();
    }
}
