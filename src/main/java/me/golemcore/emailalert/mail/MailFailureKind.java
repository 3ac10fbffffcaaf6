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

package me.golemcore.emailalert.mail;

/**
 * Classification of mail core failures.
 */
public enum MailFailureKind {

    /** Network, DNS, TLS or timeout failure. Transient. */
    CONNECT(true),

    /** Server rejected the credentials. */
    AUTH(false),

    /** Named folder does not exist or cannot be selected. */
    FOLDER(false),

    /** Search or retrieval failed on an established session. */
    FETCH(false),

    /** Outgoing message failed validation or transmission. */
    SEND(false);

    private final boolean retryable;

    MailFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
