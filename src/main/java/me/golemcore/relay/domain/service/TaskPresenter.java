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

import me.golemcore.relay.domain.model.ApprovalOption;
import me.golemcore.relay.domain.model.ApprovalRequest;
import me.golemcore.relay.domain.model.OutputSlice;
import me.golemcore.relay.domain.model.RenderedReply;
import me.golemcore.relay.domain.model.Task;
import me.golemcore.relay.domain.model.TaskStatus;
import me.golemcore.relay.domain.model.TaskView;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a task snapshot into chat content.
 *
 * <p>
 * Layout, in order: header (indicator, status, task id, session id, and for
 * {@link TaskView#STATUS} the timestamps), output, error, pending approval.
 * Output handling depends on the view:
 * <ul>
 * <li>{@link TaskView#STATUS} - up to 1200 characters inline, longer output
 * split into "chunk k of N" follow-ups of 1900 characters
 * <li>{@link TaskView#SUBMISSION} - cut at 1500 characters with a pointer to
 * {@code /status}
 * <li>{@link TaskView#APPROVAL} - cut at 1800 characters with the same pointer
 * </ul>
 * Error text is always shown in full. When the error or the approval block
 * would push the primary message past {@link #MESSAGE_LIMIT}, it is sent as
 * follow-ups after the output chunks instead; long errors are split into
 * "chunk k of N" blocks like output.
 */
@Service
public class TaskPresenter {

    public static final int STATUS_INLINE_LIMIT = 1200;
    public static final int FOLLOW_UP_CHUNK_SIZE = 1900;
    public static final int SUBMISSION_OUTPUT_CAP = 1500;
    public static final int APPROVAL_OUTPUT_CAP = 1800;
    /**
     * Largest primary message the chat platform accepts.
     */
    public static final int MESSAGE_LIMIT = 4096;

    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String FENCE_OPEN = "```\n";
    private static final String FENCE_CLOSE = "\n```";

    public RenderedReply render(Task task, TaskView view) {
        StringBuilder content = new StringBuilder(header(task, view));
        List<String> followUps = new ArrayList<>();

        if (task.hasOutput()) {
            if (view == TaskView.STATUS) {
                appendChunkedOutput(content, followUps, task.getOutput());
            } else {
                int cap = view == TaskView.SUBMISSION ? SUBMISSION_OUTPUT_CAP : APPROVAL_OUTPUT_CAP;
                appendTruncatedOutput(content, task, cap, view);
            }
        }

        String error = task.hasError() ? "*Error:*\n" + fenced(task.getError()) : null;
        String approval = task.hasPendingApproval()
                ? approvalBlock(task.getTaskId(), task.getApprovalRequest(), approvalHeading(view))
                : null;

        // Sections that would push the primary message past the platform limit go out as follow-ups
        if (fits(content, error, approval)) {
            appendSection(content, error);
            appendSection(content, approval);
        } else if (fits(content, null, approval)) {
            appendSection(content, approval);
            followUps.addAll(errorFollowUps(task.getError()));
        } else {
            if (error != null) {
                followUps.addAll(errorFollowUps(task.getError()));
            }
            if (approval != null) {
                OutputChunker.split(approval, FOLLOW_UP_CHUNK_SIZE, FOLLOW_UP_CHUNK_SIZE)
                        .forEach(slice -> followUps.add(slice.text()));
            }
        }

        return new RenderedReply(content.toString(), followUps);
    }

    private static boolean fits(CharSequence content, String error, String approval) {
        int length = content.length();
        if (error != null) {
            length += DOUBLE_NEWLINE.length() + error.length();
        }
        if (approval != null) {
            length += DOUBLE_NEWLINE.length() + approval.length();
        }
        return length <= MESSAGE_LIMIT;
    }

    private static void appendSection(StringBuilder content, String section) {
        if (section != null) {
            content.append(DOUBLE_NEWLINE).append(section);
        }
    }

    private List<String> errorFollowUps(String error) {
        List<OutputSlice> slices = OutputChunker.split(error, FOLLOW_UP_CHUNK_SIZE, FOLLOW_UP_CHUNK_SIZE);
        if (slices.size() == 1) {
            return List.of("*Error:*\n" + fenced(error));
        }
        List<String> blocks = new ArrayList<>();
        for (OutputSlice slice : slices) {
            blocks.add("*Error (chunk " + slice.index() + " of " + slice.total() + "):*\n"
                    + fenced(slice.text()));
        }
        return blocks;
    }

    private String header(Task task, TaskView view) {
        TaskStatus status = task.getStatus() != null ? task.getStatus() : TaskStatus.PENDING;
        String title = switch (view) {
        case SUBMISSION -> "Task " + status.getLabel();
        case STATUS -> "Task Status";
        case APPROVAL -> "Approval Processed";
        };

        StringBuilder header = new StringBuilder()
                .append(status.getIndicator()).append(" *").append(title).append('*')
                .append(DOUBLE_NEWLINE)
                .append("*Status:* ").append(status.getLabel()).append('\n')
                .append("*Task ID:* `").append(task.getTaskId()).append("`\n")
                .append("*Session:* `").append(task.getSessionId()).append('`');
        if (view == TaskView.STATUS) {
            header.append("\n*Created:* ").append(task.getCreatedAt())
                    .append("\n*Updated:* ").append(task.getUpdatedAt());
        }
        return header.toString();
    }

    private void appendChunkedOutput(StringBuilder content, List<String> followUps, String output) {
        List<OutputSlice> slices = OutputChunker.split(output, STATUS_INLINE_LIMIT, FOLLOW_UP_CHUNK_SIZE);
        if (slices.size() == 1) {
            content.append(DOUBLE_NEWLINE).append("*Output:*\n").append(fenced(output));
            return;
        }
        for (OutputSlice slice : slices) {
            String block = "*Output (chunk " + slice.index() + " of " + slice.total() + "):*\n"
                    + fenced(slice.text());
            if (slice.isFirst()) {
                content.append(DOUBLE_NEWLINE).append(block);
            } else {
                followUps.add(block);
            }
        }
    }

    private void appendTruncatedOutput(StringBuilder content, Task task, int cap, TaskView view) {
        String output = task.getOutput();
        String shown = output;
        if (output.length() > cap) {
            String notice = view == TaskView.SUBMISSION
                    ? ">>> (truncated - " + output.length() + " chars total) <<<"
                    : "(truncated)";
            shown = OutputChunker.truncate(output, cap) + "...\n\n" + notice
                    + "\nUse `/status task_id:" + task.getTaskId() + "` for full output";
        }
        content.append(DOUBLE_NEWLINE).append("*Output:*\n").append(fenced(shown));
    }

    private String approvalBlock(String taskId, ApprovalRequest approval, String heading) {
        StringBuilder block = new StringBuilder()
                .append('*').append(heading).append(":*\n")
                .append(approval.getDescription() != null ? approval.getDescription() : "")
                .append(DOUBLE_NEWLINE)
                .append("Use `/approve task_id:").append(taskId).append(" option:<option>` to respond.");

        List<ApprovalOption> options = approval.getOptions();
        if (options == null || options.isEmpty()) {
            return block.toString();
        }
        block.append(DOUBLE_NEWLINE).append("Options:");
        for (ApprovalOption option : options) {
            block.append("\n- ").append(option.getId()).append(": ").append(option.getLabel());
            if (option.getDescription() != null && !option.getDescription().isBlank()) {
                block.append(" (").append(option.getDescription()).append(')');
            }
        }
        return block.toString();
    }

    private String approvalHeading(TaskView view) {
        return switch (view) {
        case SUBMISSION -> "Approval Required";
        case STATUS -> "Awaiting Approval";
        case APPROVAL -> "Additional Approval Required";
        };
    }

    public static String fenced(String text) {
        return FENCE_OPEN + text + FENCE_CLOSE;
    }
}
