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
 * Base of every failure raised by the mail core. The message is a
 * human-readable reason that can be shown to the agent as-is and never
 * contains credential material.
 */
public abstract class MailException extends Exception {

    private static final long serialVersionUID = 1L;

    protected MailException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public abstract MailFailureKind getKind();

    /**
     * Whether the caller may retry the same call. The core itself never
     * retries.
     */
    public boolean isRetryable() {
        return getKind().isRetryable();
    }
}
