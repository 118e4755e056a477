package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.Project;
import me.golemcore.relay.domain.model.ProjectRequest;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.port.outbound.BackendPort;
import me.golemcore.relay.testsupport.reply.RecordingReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProjectCommandHandlerTest {

    private BackendPort backendPort;
    private ProjectCommandHandler handler;
    private RecordingReply reply;

    @BeforeEach
    void setUp() {
        backendPort = mock(BackendPort.class);
        handler = new ProjectCommandHandler(backendPort);
        reply = new RecordingReply();
    }

    @Test
    void shouldListCallersProjectsByDefault() {
        when(backendPort.listProjects("42")).thenReturn(CompletableFuture.completedFuture(List.of(
                Project.builder().name("api").path("/srv/api").description("REST API").build(),
                Project.builder().name("web").path("/srv/web").description("").build())));

        handler.handle(invocation(null, Map.of()), reply).join();

        assertEquals("⏳ Loading your projects...", reply.single(RecordingReply.ACK));
        assertEquals("*Your Projects:*\n\n`api` → `/srv/api` - REST API\n`web` → `/srv/web`",
                reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldExplainHowToAddWhenNoProjects() {
        assertTrue(ProjectCommandHandler.formatProjects(List.of()).contains("No projects registered."));
    }

    @Test
    void shouldRequireNameAndPathForAdd() {
        handler.handle(invocation("add", Map.of("name", "api")), reply).join();

        assertEquals(ProjectCommandHandler.MSG_NAME_AND_PATH_REQUIRED, reply.single(RecordingReply.RESPOND));
        verifyNoInteractions(backendPort);
    }

    @Test
    void shouldAddProjectForCaller() {
        when(backendPort.addProject(any())).thenReturn(CompletableFuture.completedFuture(
                Project.builder().name("api").path("/srv/api").build()));

        handler.handle(invocation("add", Map.of("name", "api", "path", "/srv/api", "description", "REST API")),
                reply).join();

        ArgumentCaptor<ProjectRequest> captor = ArgumentCaptor.forClass(ProjectRequest.class);
        verify(backendPort).addProject(captor.capture());
        assertEquals("42", captor.getValue().getDiscordUserId());
        assertEquals("REST API", captor.getValue().getDescription());
        assertTrue(reply.single(RecordingReply.EDIT).startsWith("✅ *Project Added*"));
    }

    @Test
    void shouldRemoveProject() {
        when(backendPort.removeProject("42", "api")).thenReturn(CompletableFuture.completedFuture(null));

        handler.handle(invocation("remove", Map.of("name", "api")), reply).join();

        assertEquals("✅ Project `api` has been removed.", reply.single(RecordingReply.EDIT));
    }

    @Test
    void shouldRequireNameForRemove() {
        handler.handle(invocation("remove", Map.of()), reply).join();

        assertEquals(ProjectCommandHandler.MSG_NAME_REQUIRED, reply.single(RecordingReply.RESPOND));
    }

    @Test
    void shouldRejectUnknownSubcommand() {
        handler.handle(invocation("rename", Map.of()), reply).join();

        assertEquals(ProjectCommandHandler.MSG_UNKNOWN_SUBCOMMAND, reply.single(RecordingReply.RESPOND));
        verifyNoInteractions(backendPort);
    }

    private static CommandInvocation invocation(String subcommand, Map<String, String> options) {
        return CommandInvocation.builder()
                .command("project")
                .subcommand(subcommand)
                .actor(new UserIdentity("42", "@alice"))
                .options(options)
                .build();
    }
}
