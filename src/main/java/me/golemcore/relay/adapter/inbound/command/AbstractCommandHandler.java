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

package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.service.TaskPresenter;
import me.golemcore.relay.port.inbound.InteractionReply;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reply sequencing shared by all command handlers.
 *
 * <p>
 * Backend-bound commands go through
 * {@link #acknowledgeThenEdit(String, InteractionReply, String, Supplier, Function, Function)}:
 * <ol>
 * <li>send the acknowledgement; if that fails the invocation is abandoned and
 * the backend is not called
 * <li>call the backend
 * <li>replace the acknowledgement with the rendered result or the error text
 * <li>send follow-ups one after another, only after the edit succeeded; a
 * failed follow-up is logged and the next one is still sent
 * </ol>
 * Validation failures and other local answers use {@link #respond}.
 */
@Slf4j
public abstract class AbstractCommandHandler implements CommandHandler {

    protected static final String DOUBLE_NEWLINE = "\n\n";

    protected <T> CompletableFuture<Void> acknowledgeThenEdit(
            String operation,
            InteractionReply reply,
            String acknowledgement,
            Supplier<CompletableFuture<T>> backendCall,
            Function<T, RenderedReply> onSuccess,
            Function<Throwable, String> onFailure) {

        return safely(() -> reply.acknowledge(acknowledgement))
                .handle((ignored, ackError) -> ackError)
                .thenCompose(ackError -> {
                    if (ackError != null) {
                        log.error("[Command] Failed to send acknowledgement for {}: {}",
                                operation, errorMessage(ackError));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return safely(backendCall)
                            .handle((result, error) -> settle(operation, result, error, onSuccess, onFailure))
                            .thenCompose(rendered -> deliver(operation, reply, rendered));
                });
    }

    /**
     * Single-phase response. Delivery failures are logged.
     */
    protected CompletableFuture<Void> respond(InteractionReply reply, String content) {
        return safely(() -> reply.respond(content))
                .exceptionally(e -> {
                    log.error("[Command] Failed to send response: {}", errorMessage(e));
                    return null;
                });
    }

    /**
     * Standard failure layout: marker, bold title, error text in a fenced block.
     */
    protected static String failure(String title, Throwable error) {
        return "❌ *" + title + "*" + DOUBLE_NEWLINE + TaskPresenter.fenced(errorMessage(error));
    }

    protected static String errorMessage(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    protected static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private <T> RenderedReply settle(String operation, T result, Throwable error,
            Function<T, RenderedReply> onSuccess, Function<Throwable, String> onFailure) {
        if (error != null) {
            Throwable cause = unwrap(error);
            log.error("[Command] {} failed: {}", operation, errorMessage(cause));
            return RenderedReply.of(onFailure.apply(cause));
        }
        try {
            return onSuccess.apply(result);
        } catch (RuntimeException e) {
            log.error("[Command] Failed to render {} result", operation, e);
            return RenderedReply.of(failure("Command Failed", e));
        }
    }

    private CompletableFuture<Void> deliver(String operation, InteractionReply reply, RenderedReply rendered) {
        return safely(() -> reply.edit(rendered.content()))
                .thenCompose(ignored -> sendFollowUps(operation, reply, rendered.followUps()))
                .exceptionally(e -> {
                    log.error("[Command] Failed to edit {} response: {}", operation, errorMessage(e));
                    return null;
                });
    }

    private CompletableFuture<Void> sendFollowUps(String operation, InteractionReply reply, List<String> followUps) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < followUps.size(); i++) {
            String content = followUps.get(i);
            int position = i + 1;
            chain = chain.thenCompose(ignored -> safely(() -> reply.followUp(content))
                    .exceptionally(e -> {
                        log.warn("[Command] Failed to send {} follow-up {}/{}: {}",
                                operation, position, followUps.size(), errorMessage(e));
                        return null;
                    }));
        }
        return chain;
    }

    private static <T> CompletableFuture<T> safely(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
