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
import me.golemcore.relay.domain.model.CommandOption;
import me.golemcore.relay.domain.model.OptionType;
import me.golemcore.relay.domain.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a Telegram command message into a {@link CommandInvocation}.
 *
 * <p>
 * Syntax: {@code /command[@bot] [subcommand] [name:value | name:"quoted value"]... [free text]}.
 * <ul>
 * <li>For commands with sub-commands the first bare token selects the
 * sub-command; without one the command's default applies
 * <li>{@code name:value} fills a declared option; undeclared names stay part
 * of the free text
 * <li>Remaining text fills the option declared as free text verbatim, only
 * trimmed at both ends, so indentation and line breaks survive
 * <li>User options take a numeric Telegram id or a {@code text_mention}
 * entity; anything else is dropped
 * </ul>
 * The acting user always comes from {@code message.from}.
 */
@Component
@Slf4j
public class TelegramCommandParser {

    static final String CHANNEL_TYPE = "telegram";

    private static final String TEXT_MENTION = "text_mention";
    private static final String MENTION_PREFIX = "tg://user?id=";
    private static final Pattern COMMAND = Pattern.compile("^/([A-Za-z0-9_]+)(?:@\\S*)?");
    private static final Pattern NAMED = Pattern.compile("^([a-z_]+):(.*)$", Pattern.DOTALL);
    private static final Pattern NUMERIC_ID = Pattern.compile("^\\d+$");

    /**
     * Command name without slash and bot suffix, lower-cased, if the text is a
     * command at all.
     */
    public static Optional<String> commandName(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = COMMAND.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    /**
     * @param definition
     *            schema of the addressed command, or {@code null} when the
     *            command is unknown; only the name and actor are filled then
     */
    public CommandInvocation parse(Message message, CommandDefinition definition) {
        Map<String, UserIdentity> mentioned = new HashMap<>();
        String text = inlineMentions(message, mentioned);

        Matcher matcher = COMMAND.matcher(text);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Not a command message");
        }

        CommandInvocation.CommandInvocationBuilder builder = CommandInvocation.builder()
                .command(matcher.group(1).toLowerCase(Locale.ROOT))
                .actor(identity(message.getFrom()))
                .chatId(String.valueOf(message.getChatId()))
                .channelType(CHANNEL_TYPE);
        if (definition == null) {
            return builder.build();
        }

        String arguments = text.substring(matcher.end());
        List<Token> tokens = tokenize(arguments);

        String subcommand = null;
        int firstArgument = 0;
        if (definition.hasSubcommands()) {
            if (!tokens.isEmpty() && !NAMED.matcher(tokens.get(0).text()).matches()) {
                subcommand = tokens.get(0).text().toLowerCase(Locale.ROOT);
                firstArgument = 1;
            } else {
                subcommand = definition.defaultSubcommand();
            }
        }

        Map<String, CommandOption> declared = new LinkedHashMap<>();
        definition.optionsFor(subcommand).forEach(option -> declared.put(option.name(), option));

        Map<String, String> options = new LinkedHashMap<>();
        Map<String, UserIdentity> resolvedUsers = new HashMap<>();
        StringBuilder freeText = new StringBuilder();
        int previousEnd = firstArgument > 0 ? tokens.get(0).end() : 0;

        for (int i = firstArgument; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Matcher named = NAMED.matcher(token.text());
            CommandOption option = named.matches() ? declared.get(named.group(1)) : null;
            if (option != null) {
                putOption(options, resolvedUsers, mentioned, option, unquote(named.group(2)));
            } else {
                if (freeText.length() > 0) {
                    freeText.append(arguments, previousEnd, token.start());
                }
                freeText.append(token.text());
            }
            previousEnd = token.end();
        }

        String leftover = freeText.toString().strip();
        if (!leftover.isEmpty()) {
            Optional<CommandOption> freeTextOption = declared.values().stream()
                    .filter(CommandOption::freeText)
                    .findFirst();
            if (freeTextOption.isPresent() && !options.containsKey(freeTextOption.get().name())) {
                putOption(options, resolvedUsers, mentioned, freeTextOption.get(), leftover);
            } else {
                log.debug("[Telegram] Ignoring unlabelled text for /{}", definition.name());
            }
        }

        return builder.subcommand(subcommand)
                .options(Map.copyOf(options))
                .resolvedUsers(Map.copyOf(resolvedUsers))
                .build();
    }

    static UserIdentity identity(User user) {
        if (user == null) {
            return null;
        }
        String displayName;
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            displayName = "@" + user.getUserName();
        } else if (user.getLastName() != null && !user.getLastName().isBlank()) {
            displayName = user.getFirstName() + " " + user.getLastName();
        } else {
            displayName = user.getFirstName();
        }
        return new UserIdentity(String.valueOf(user.getId()), displayName);
    }

    static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int length = input.length();
        int i = 0;
        while (i < length) {
            while (i < length && Character.isWhitespace(input.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int start = i;
            boolean quoted = false;
            while (i < length && (quoted || !Character.isWhitespace(input.charAt(i)))) {
                if (input.charAt(i) == '"') {
                    quoted = !quoted;
                }
                i++;
            }
            tokens.add(new Token(input.substring(start, i), start, i));
        }
        return tokens;
    }

    private void putOption(Map<String, String> options, Map<String, UserIdentity> resolvedUsers,
            Map<String, UserIdentity> mentioned, CommandOption option, String value) {
        if (option.type() != OptionType.USER) {
            options.put(option.name(), value);
            return;
        }
        String userId = value.startsWith(MENTION_PREFIX) ? value.substring(MENTION_PREFIX.length()) : value;
        if (!NUMERIC_ID.matcher(userId).matches()) {
            log.debug("[Telegram] Dropping unresolvable user for option {}: {}", option.name(), value);
            return;
        }
        options.put(option.name(), userId);
        UserIdentity known = mentioned.get(userId);
        if (known != null) {
            resolvedUsers.put(userId, known);
        }
    }

    /**
     * Replaces every {@code text_mention} entity with a {@code tg://user?id=}
     * token so the mentioned user survives tokenizing. Entity offsets are in
     * UTF-16 code units, the same unit Java strings index by.
     */
    private String inlineMentions(Message message, Map<String, UserIdentity> mentioned) {
        String text = message.getText();
        List<MessageEntity> entities = message.getEntities();
        if (entities == null || entities.isEmpty()) {
            return text;
        }
        List<MessageEntity> mentions = entities.stream()
                .filter(entity -> TEXT_MENTION.equals(entity.getType()) && entity.getUser() != null)
                .sorted(Comparator.comparing(MessageEntity::getOffset).reversed())
                .toList();

        StringBuilder sb = new StringBuilder(text);
        for (MessageEntity entity : mentions) {
            int start = entity.getOffset();
            int end = start + entity.getLength();
            if (start < 0 || end > sb.length()) {
                continue;
            }
            UserIdentity user = identity(entity.getUser());
            mentioned.put(user.id(), user);
            sb.replace(start, end, MENTION_PREFIX + user.id());
        }
        return sb.toString();
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    record Token(String text, int start, int end) {
    }
}
