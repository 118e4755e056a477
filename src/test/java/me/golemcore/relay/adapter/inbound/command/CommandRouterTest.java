package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.CommandDefinition;
import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.UserIdentity;
import me.golemcore.relay.testsupport.reply.RecordingReply;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    @Test
    void shouldOrderCommandsAndAppendHelp() {
        CommandRouter router = new CommandRouter(List.of(
                handler("share"), handler("task"), handler("status")));

        List<String> names = router.listCommands().stream().map(CommandDefinition::name).toList();

        assertEquals(List.of("task", "status", "share", "help"), names);
        assertTrue(router.hasCommand("help"));
        assertTrue(router.hasCommand("share"));
        assertFalse(router.hasCommand("deploy"));
    }

    @Test
    void shouldRejectDuplicateHandlers() {
        List<CommandHandler> handlers = List.of(handler("task"), handler("task"));

        assertThrows(IllegalStateException.class, () -> new CommandRouter(handlers));
    }

    @Test
    void shouldDispatchToMatchingHandlerOnly() {
        CommandHandler task = handler("task");
        CommandHandler status = handler("status");
        CommandRouter router = new CommandRouter(List.of(task, status));
        RecordingReply reply = new RecordingReply();

        router.execute(invocation("status"), reply).join();

        verify(status).handle(any(), any());
        verify(task, never()).handle(any(), any());
    }

    @Test
    void shouldAnswerHelpLocally() {
        CommandRouter router = new CommandRouter(List.of(handler("task")));
        RecordingReply reply = new RecordingReply();

        router.execute(invocation("help"), reply).join();

        String help = reply.single(RecordingReply.RESPOND);
        assertTrue(help.startsWith("*Available Commands*\n"));
        assertTrue(help.contains("\n/task - task command\n`/task`"));
        assertTrue(help.contains("\n/help - Show available commands\n`/help`"));
    }

    @Test
    void shouldPointUnknownCommandsToHelp() {
        CommandRouter router = new CommandRouter(List.of(handler("task")));
        RecordingReply reply = new RecordingReply();

        router.execute(invocation("deploy"), reply).join();

        assertEquals("Unknown command: /deploy. Use /help to see available commands.",
                reply.single(RecordingReply.RESPOND));
    }

    @Test
    void shouldReportHandlerThatThrows() {
        CommandHandler broken = handler("task");
        when(broken.handle(any(), any())).thenThrow(new IllegalStateException("broken handler"));
        CommandRouter router = new CommandRouter(List.of(broken));
        RecordingReply reply = new RecordingReply();

        router.execute(invocation("task"), reply).join();

        assertEquals("❌ *Command Failed*\n\n```\nbroken handler\n```", reply.single(RecordingReply.RESPOND));
    }

    @Test
    void shouldCompleteNormallyWhenHandlerFutureFails() {
        CommandHandler failing = handler("task");
        when(failing.handle(any(), any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("x")));
        CommandRouter router = new CommandRouter(List.of(failing));

        router.execute(invocation("task"), new RecordingReply()).join();
    }

    private static CommandHandler handler(String name) {
        CommandHandler handler = mock(CommandHandler.class);
        when(handler.definition()).thenReturn(CommandDefinition.simple(name, name + " command", "/" + name, List.of()));
        when(handler.handle(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        return handler;
    }

    private static CommandInvocation invocation(String command) {
        return CommandInvocation.builder()
                .command(command)
                .actor(new UserIdentity("42", "@alice"))
                .build();
    }
}
