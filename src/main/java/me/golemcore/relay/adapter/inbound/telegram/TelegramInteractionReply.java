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

package me.golemcore.relay.adapter.inbound.telegram;

import me.golemcore.relay.port.inbound.InteractionReply;

import java.util.concurrent.CompletableFuture;

/**
 * Reply handle for one command message in one chat. The acknowledgement is a
 * regular message whose id is kept for the later edit.
 */
class TelegramInteractionReply implements InteractionReply {

    private final TelegramAdapter adapter;
    private final String chatId;
    private volatile Integer acknowledgementId;

    TelegramInteractionReply(TelegramAdapter adapter, String chatId) {
        this.adapter = adapter;
        this.chatId = chatId;
    }

    @Override
    public CompletableFuture<Void> acknowledge(String content) {
        return adapter.sendText(chatId, content)
                .thenAccept(messageId -> acknowledgementId = messageId);
    }

    @Override
    public CompletableFuture<Void> edit(String content) {
        Integer messageId = acknowledgementId;
        if (messageId == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No acknowledgement to edit in chat " + chatId));
        }
        return adapter.editText(chatId, messageId, content);
    }

    @Override
    public CompletableFuture<Void> respond(String content) {
        return adapter.sendText(chatId, content).thenAccept(messageId -> {
        });
    }

    @Override
    public CompletableFuture<Void> followUp(String content) {
        return respond(content);
    }
}
