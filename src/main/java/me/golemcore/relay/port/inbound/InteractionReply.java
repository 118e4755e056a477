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

package me.golemcore.relay.port.inbound;

import java.util.concurrent.CompletableFuture;

/**
 * Response handle for a single command invocation, supplied by the channel
 * that received it.
 *
 * <p>
 * Commands that call the backend use the two-phase form: {@link #acknowledge}
 * right away, then {@link #edit} once the call resolves, then any
 * {@link #followUp} messages in order. Commands answered locally use
 * {@link #respond} once.
 */
public interface InteractionReply {

    /**
     * Sends the immediate "processing" message that will later be replaced.
     */
    CompletableFuture<Void> acknowledge(String content);

    /**
     * Replaces the acknowledgement with the final content. Fails if no
     * acknowledgement was delivered.
     */
    CompletableFuture<Void> edit(String content);

    /**
     * Sends a single, final response without an acknowledgement.
     */
    CompletableFuture<Void> respond(String content);

    /**
     * Sends an additional message after the primary one.
     */
    CompletableFuture<Void> followUp(String content);
}
