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

package me.golemcore.emailalert.domain.model;

/**
 * Tri-state read-flag constraint of a {@link FilterCriteria}.
 */
public enum ReadStatus {

    /** No constraint on the {@code \Seen} flag. */
    ANY,

    /** Only messages without {@code \Seen}. */
    UNREAD,

    /** Only messages with {@code \Seen}. */
    READ;

    /**
     * Maps an optional {@code is_unread} tool argument onto a read status.
     *
     * @param unread
     *            {@code true} for unread only, {@code false} for read only,
     *            {@code null} for no constraint
     * @return the matching status
     */
    public static ReadStatus fromUnreadFlag(Boolean unread) {
        if (unread == null) {
            return ANY;
        }
        return unread ? UNREAD : READ;
    }
}
