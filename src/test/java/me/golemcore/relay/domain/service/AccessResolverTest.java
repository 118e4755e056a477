package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.UserIdentity;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccessResolverTest {

    private static final UserIdentity ALICE = new UserIdentity("42", "@alice");

    private final AccessResolver resolver = new AccessResolver();

    @Test
    void shouldUseCallerAsActorAndLeaveTargetEmpty() {
        CommandInvocation invocation = CommandInvocation.builder().command("task").actor(ALICE).build();

        AccessResolver.ExecutionIdentity identity = resolver.resolve(invocation, "target");

        assertSame(ALICE, identity.actor());
        assertTrue(identity.target().isEmpty());
    }

    @Test
    void shouldCarryRequestedTargetWithResolvedName() {
        CommandInvocation invocation = CommandInvocation.builder()
                .command("task")
                .actor(ALICE)
                .options(Map.of("target", "7"))
                .resolvedUsers(Map.of("7", new UserIdentity("7", "Bob")))
                .build();

        AccessResolver.ExecutionIdentity identity = resolver.resolve(invocation, "target");

        assertSame(ALICE, identity.actor());
        assertEquals("Bob", identity.target().orElseThrow().nameOrId());
    }

    @Test
    void shouldFallBackToIdForUnresolvedTarget() {
        CommandInvocation invocation = CommandInvocation.builder()
                .command("task")
                .actor(ALICE)
                .options(Map.of("target", "7"))
                .build();

        assertEquals("7", resolver.resolve(invocation, "target").target().orElseThrow().nameOrId());
    }

    @Test
    void shouldAlwaysUseCallerAsShareOwner() {
        CommandInvocation invocation = CommandInvocation.builder()
                .command("share")
                .actor(ALICE)
                .options(Map.of("user", "7"))
                .build();

        assertSame(ALICE, resolver.shareOwner(invocation));
    }

    @Test
    void shouldDetectSelfShareById() {
        assertTrue(resolver.isSelfShare(ALICE, UserIdentity.of("42")));
        assertFalse(resolver.isSelfShare(ALICE, UserIdentity.of("7")));
        assertFalse(resolver.isSelfShare(ALICE, null));
    }

    @Test
    void shouldHintRegistrationForMissingUserErrors() {
        assertEquals(AccessResolver.REGISTRATION_HINT, resolver.registrationHint("User NOT FOUND"));
        assertEquals(AccessResolver.REGISTRATION_HINT, resolver.registrationHint("caller is not registered"));
        assertEquals("", resolver.registrationHint("Connection refused"));
        assertEquals("", resolver.registrationHint(null));
    }
}
