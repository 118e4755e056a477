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
 * Content ready to be delivered: the primary message and the follow-up
 * messages that must be sent after it, in order.
 */
public record RenderedReply(String content, List<String> followUps) {

    public RenderedReply {
        followUps = followUps != null ? List.copyOf(followUps) : List.of();
    }

    public static RenderedReply of(String content) {
        return new RenderedReply(content, List.of());
    }
}
