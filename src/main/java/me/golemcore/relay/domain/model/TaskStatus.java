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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states reported by the backend for a task.
 *
 * <p>
 * {@code PENDING -> RUNNING -> COMPLETED | FAILED | NEEDS_APPROVAL}. Submitting
 * an approval moves a task out of {@code NEEDS_APPROVAL} into any state,
 * including another {@code NEEDS_APPROVAL}.
 */
public enum TaskStatus {
    PENDING("pending", "Pending", "⏳"),
    RUNNING("running", "Running", "🔄"),
    COMPLETED("completed", "Completed", "✅"),
    FAILED("failed", "Failed", "❌"),
    NEEDS_APPROVAL("needs_approval", "Needs Approval", "⚠️");

    private final String code;
    private final String label;
    private final String indicator;

    TaskStatus(String code, String label, String indicator) {
        this.code = code;
        this.label = label;
        this.indicator = indicator;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * One-glyph marker shown in front of every rendered task header.
     */
    public String getIndicator() {
        return indicator;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static TaskStatus fromCode(String code) {
        for (TaskStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + code);
    }

    @Override
    public String toString() {
        return label;
    }
}
