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

import me.golemcore.relay.domain.model.CommandDefinition;
import me.golemcore.relay.domain.model.CommandInvocation;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.CommandPort;
import me.golemcore.relay.security.AllowlistValidator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeChat;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Long polling for incoming messages via Telegram Bot API
 * <li>User authorization via allowlist
 * <li>Command registration with {@code setMyCommands}, chat-scoped when a
 * group is configured
 * <li>Command parsing with {@link TelegramCommandParser} and routing to
 * {@link CommandPort}
 * <li>Acknowledge-then-edit replies through {@link TelegramInteractionReply}
 * <li>Markdown with plain text fallback, rate limit (429) retry
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code relay.telegram.enabled=true} and a token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements LongPollingSingleThreadUpdateConsumer {

    static final String MSG_UNAUTHORIZED = "⛔ You are not authorized to use this bot.";
    static final String MSG_COMMANDS_ONLY = "I only understand commands. Use /help to see available commands.";

    private static final String PARSE_MODE = "Markdown";
    private static final String PRIVATE_CHAT = "private";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final int RETRY_AFTER_CAP_SECONDS = 30;
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 5;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)");

    private final RelayProperties properties;
    private final AllowlistValidator allowlistValidator;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final ObjectProvider<CommandPort> commandRouter;
    private final TelegramCommandParser commandParser;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private String token() {
        return properties.getTelegram().getToken();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled()) {
            return;
        }
        String token = token();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }

            registerCommands();
            try {
                botsApplication.registerBot(token(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Publishes the command menu. Scoped to the configured group chat when there
     * is one, global otherwise. Failures are logged and ignored.
     */
    void registerCommands() {
        CommandPort router = commandRouter.getIfAvailable();
        if (router == null) {
            return;
        }
        List<BotCommand> commands = router.listCommands().stream()
                .map(definition -> new BotCommand(definition.name(), definition.description()))
                .toList();

        String scopeChatId = properties.getTelegram().getCommandScopeChatId();
        boolean chatScoped = scopeChatId != null && !scopeChatId.isBlank();
        SetMyCommands request = chatScoped
                ? SetMyCommands.builder()
                        .commands(commands)
                        .scope(BotCommandScopeChat.builder().chatId(scopeChatId).build())
                        .build()
                : SetMyCommands.builder().commands(commands).build();

        try {
            executeWithRetry(() -> telegramClient.execute(request));
            log.info("[Telegram] Registered {} commands ({})", commands.size(),
                    chatScoped ? "chat " + scopeChatId : "global");
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to register commands", e);
        }
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleMessage(Message message) {
        if (message.getFrom() == null || !message.hasText()) {
            return;
        }
        String chatId = message.getChatId().toString();
        String userId = message.getFrom().getId().toString();

        String command = TelegramCommandParser.commandName(message.getText()).orElse(null);
        boolean allowed = allowlistValidator.isAllowed(userId);
        if (command == null) {
            if (allowed && isPrivateChat(message)) {
                sendQuietly(chatId, MSG_COMMANDS_ONLY);
            }
            return;
        }
        if (!allowed) {
            log.warn("[Telegram] Unauthorized user: {} in chat: {}", userId, chatId);
            sendQuietly(chatId, MSG_UNAUTHORIZED);
            return;
        }

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null) {
            log.warn("[Telegram] No command router available, ignoring /{}", command);
            return;
        }

        CommandDefinition definition = router.listCommands().stream()
                .filter(candidate -> candidate.name().equals(command))
                .findFirst()
                .orElse(null);
        CommandInvocation invocation = commandParser.parse(message, definition);

        router.execute(invocation, new TelegramInteractionReply(this, chatId))
                .exceptionally(e -> {
                    log.error("[Telegram] Command execution failed: /{}", command, e);
                    return null;
                });
    }

    /**
     * Sends a message and returns its id.
     */
    CompletableFuture<Integer> sendText(String chatId, String content) {
        return CompletableFuture.supplyAsync(() -> {
            String text = truncate(content);
            SendMessage formatted = SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .build();
            try {
                Message sent;
                try {
                    sent = executeWithRetry(() -> telegramClient.execute(formatted));
                } catch (TelegramApiException markdownEx) {
                    // Fallback: retry without formatting if Markdown parsing fails
                    log.debug("[Telegram] Markdown send failed, retrying as plain text: {}",
                            markdownEx.getMessage());
                    SendMessage plain = SendMessage.builder()
                            .chatId(chatId)
                            .text(text)
                            .build();
                    sent = executeWithRetry(() -> telegramClient.execute(plain));
                }
                return sent != null ? sent.getMessageId() : null;
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to send message to chat: {}", chatId, e);
                throw new CompletionException(new IllegalStateException("Failed to send message", e));
            }
        });
    }

    /**
     * Replaces the text of a message sent earlier by the bot.
     */
    CompletableFuture<Void> editText(String chatId, Integer messageId, String content) {
        return CompletableFuture.runAsync(() -> {
            String text = truncate(content);
            EditMessageText formatted = EditMessageText.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .build();
            try {
                try {
                    executeWithRetry(() -> telegramClient.execute(formatted));
                } catch (TelegramApiException markdownEx) {
                    log.debug("[Telegram] Markdown edit failed, retrying as plain text: {}",
                            markdownEx.getMessage());
                    EditMessageText plain = EditMessageText.builder()
                            .chatId(chatId)
                            .messageId(messageId)
                            .text(text)
                            .build();
                    executeWithRetry(() -> telegramClient.execute(plain));
                }
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to edit message {} in chat: {}", messageId, chatId, e);
                throw new CompletionException(new IllegalStateException("Failed to edit message", e));
            }
        });
    }

    private static boolean isPrivateChat(Message message) {
        return message.getChat() != null && PRIVATE_CHAT.equals(message.getChat().getType());
    }

    private void sendQuietly(String chatId, String content) {
        sendText(chatId, content).exceptionally(e -> null);
    }

    static String truncate(String content) {
        String text = content != null && !content.isEmpty() ? content : "(empty)";
        if (text.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
            return text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
        }
        return text;
    }

    // ===== Rate-limit retry logic =====

    @FunctionalInterface
    interface TelegramApiCall<T> {
        T execute() throws TelegramApiException;
    }

    <T> T executeWithRetry(TelegramApiCall<T> call) throws TelegramApiException {
        for (int attempt = 0;; attempt++) {
            try {
                return call.execute();
            } catch (TelegramApiRequestException e) {
                if (!isRateLimited(e) || attempt >= MAX_RETRY_ATTEMPTS) {
                    throw e;
                }
                int retryAfter = extractRetryAfterSeconds(e);
                log.warn("[Telegram] Rate limited (429), waiting {}s before retry (attempt {}/{})",
                        retryAfter, attempt + 1, MAX_RETRY_ATTEMPTS);
                sleepForRetry(retryAfter);
            }
        }
    }

    private boolean isRateLimited(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS;
    }

    int extractRetryAfterSeconds(TelegramApiRequestException e) {
        if (e.getParameters() != null && e.getParameters().getRetryAfter() != null) {
            return Math.min(e.getParameters().getRetryAfter(), RETRY_AFTER_CAP_SECONDS);
        }
        String message = e.getMessage();
        if (message != null) {
            Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
            if (matcher.find()) {
                return Math.min(Integer.parseInt(matcher.group(1)), RETRY_AFTER_CAP_SECONDS);
            }
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }

    /**
     * Package-private for testing, allows tests to override sleep behavior.
     */
    void sleepForRetry(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
