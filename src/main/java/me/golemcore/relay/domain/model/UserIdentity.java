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
 * A chat platform identity. For the acting user it is always taken from the
 * authenticated update, never from message text.
 */
public record UserIdentity(String id, String displayName) {

    public static UserIdentity of(String id) {
        return new UserIdentity(id, null);
    }

    /**
     * Display name if known, otherwise the raw id.
     */
    public String nameOrId() {
        return displayName != null && !displayName.isBlank() ? displayName : id;
    }

    public boolean sameAs(UserIdentity other) {
        return other != null && id != null && id.equals(other.id);
    }
}
