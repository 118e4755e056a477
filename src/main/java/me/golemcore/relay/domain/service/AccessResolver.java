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

import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.domain.model.UserIdentity;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides whose execution endpoint a request targets and words access-related
 * feedback.
 *
 * <p>
 * The acting identity is always the authenticated caller. A target identity is
 * only a request: it is forwarded to the backend, which checks the sharing
 * relation and rejects unauthorized use. Sharing management always runs with
 * the caller as owner.
 */
@Service
public class AccessResolver {

    public static final String SELF_SHARE_DENIAL = "You already have access to your own wrapper!";
    public static final String REGISTRATION_HINT =
            "\n\n*Hint:* You may need to register first with `/register local url:<your-wrapper-url>`";

    /**
     * Acting identity and the optional, unverified target of a task request.
     */
    public record ExecutionIdentity(UserIdentity actor, UserIdentity requestedTarget) {

        public Optional<UserIdentity> target() {
            return Optional.ofNullable(requestedTarget);
        }
    }

    public ExecutionIdentity resolve(CommandInvocation invocation, String targetOption) {
        UserIdentity target = invocation.userOption(targetOption).orElse(null);
        return new ExecutionIdentity(invocation.getActor(), target);
    }

    /**
     * Owner for share grant, revoke and list. Never taken from options.
     */
    public UserIdentity shareOwner(CommandInvocation invocation) {
        return invocation.getActor();
    }

    public boolean isSelfShare(UserIdentity owner, UserIdentity target) {
        return owner != null && owner.sameAs(target);
    }

    /**
     * Hint appended to a task failure that looks like a missing registration.
     */
    public String registrationHint(String errorMessage) {
        if (errorMessage == null) {
            return "";
        }
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        if (lower.contains("not found") || lower.contains("not registered")) {
            return REGISTRATION_HINT;
        }
        return "";
    }
}
