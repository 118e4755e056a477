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

/**
 * The three places a task snapshot is shown, each with its own header and
 * output size policy.
 */
public enum TaskView {
    /** Result of {@code /task}: output truncated at 1500 characters. */
    SUBMISSION,
    /** Result of {@code /status}: output split into follow-up chunks. */
    STATUS,
    /** Result of {@code /approve}: output truncated at 1800 characters. */
    APPROVAL
}
