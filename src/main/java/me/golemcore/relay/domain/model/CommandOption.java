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

package me.golemcore.relay.domain.model;

import java.util.List;

/**
 * Declared option of a command or sub-command.
 *
 * @param freeText
 *            whether unlabelled text of the invocation is collected into this
 *            option
 * @param choices
 *            allowed values, empty when the option is unrestricted
 */
public record CommandOption(
        String name,
        String description,
        OptionType type,
        boolean required,
        boolean freeText,
        List<String> choices) {

    public static CommandOption text(String name, String description, boolean required) {
        return new CommandOption(name, description, OptionType.STRING, required, false, List.of());
    }

    public static CommandOption freeText(String name, String description, boolean required) {
        return new CommandOption(name, description, OptionType.STRING, required, true, List.of());
    }

    public static CommandOption user(String name, String description, boolean required) {
        return new CommandOption(name, description, OptionType.USER, required, false, List.of());
    }

    public static CommandOption choice(String name, String description, List<String> choices) {
        return new CommandOption(name, description, OptionType.STRING, false, false, List.copyOf(choices));
    }

    public CommandOption asFreeText() {
        return new CommandOption(name, description, type, required, true, choices);
    }
}
