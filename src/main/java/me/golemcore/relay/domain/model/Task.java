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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one backend task as returned by the submit, fetch and approve
 * endpoints. Never cached: every rendering works on a fresh copy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Task {

    private String taskId;
    private String sessionId;
    private TaskStatus status;

    @Builder.Default
    private String output = "";

    private String error;
    private ApprovalRequest approvalRequest;
    private String createdAt;
    private String updatedAt;

    public boolean hasOutput() {
        return output != null && !output.isEmpty();
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    public boolean hasPendingApproval() {
        return approvalRequest != null;
    }
}
