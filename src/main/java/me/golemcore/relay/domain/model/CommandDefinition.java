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
import java.util.Optional;

/**
 * Schema of one slash command: its options, or its sub-commands when it has
 * any. Channel adapters use it both to register the command with the platform
 * and to parse incoming text into a {@link CommandInvocation}.
 */
public record CommandDefinition(
        String name,
        String description,
        String usage,
        List<CommandOption> options,
        List<SubcommandDefinition> subcommands,
        String defaultSubcommand) {

    public CommandDefinition {
        options = options != null ? List.copyOf(options) : List.of();
        subcommands = subcommands != null ? List.copyOf(subcommands) : List.of();
    }

    public static CommandDefinition simple(String name, String description, String usage,
            List<CommandOption> options) {
        return new CommandDefinition(name, description, usage, options, List.of(), null);
    }

    public static CommandDefinition grouped(String name, String description, String usage,
            List<SubcommandDefinition> subcommands, String defaultSubcommand) {
        return new CommandDefinition(name, description, usage, List.of(), subcommands, defaultSubcommand);
    }

    public boolean hasSubcommands() {
        return !subcommands.isEmpty();
    }

    public Optional<SubcommandDefinition> findSubcommand(String subcommand) {
        return subcommands.stream()
                .filter(candidate -> candidate.name().equals(subcommand))
                .findFirst();
    }

    /**
     * Options that apply to the given sub-command, or the top-level options when
     * the command has no sub-commands.
     */
    public List<CommandOption> optionsFor(String subcommand) {
        if (!hasSubcommands()) {
            return options;
        }
        return findSubcommand(subcommand)
                .map(SubcommandDefinition::options)
                .orElse(List.of());
    }
}
