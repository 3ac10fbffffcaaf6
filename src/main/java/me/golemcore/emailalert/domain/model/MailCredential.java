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

import java.util.Objects;

/**
 * Mail account identity, secret and server endpoints. Created once at startup
 * and shared read-only by every operation.
 *
 * <p>
 * The password never leaves this object in readable form: {@link #toString()}
 * masks it and {@link #redact(String)} scrubs both username and password from
 * text that is about to be logged or returned to a caller.
 */
public record MailCredential(String username, String password,
        String imapHost, int imapPort,
        String smtpHost, int smtpPort) {

    private static final String MASK = "***";

    public MailCredential {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(imapHost, "imapHost");
        Objects.requireNonNull(smtpHost, "smtpHost");
    }

    /**
     * Removes the username and password from the given text.
     *
     * @param text
     *            message that may contain credential material, may be null
     * @return scrubbed text, or {@code "Unknown error"} for null
     */
    public String redact(String text) {
        if (text == null) {
            return "Unknown error";
        }
        String sanitized = text;
        if (!password.isBlank()) {
            sanitized = sanitized.replace(password, MASK);
        }
        if (!username.isBlank()) {
            sanitized = sanitized.replace(username, MASK);
        }
        return sanitized;
    }

    @Override
    public String toString() {
        return "MailCredential[username=" + username
                + ", password=" + MASK
                + ", imap=" + imapHost + ":" + imapPort
                + ", smtp=" + smtpHost + ":" + smtpPort + "]";
    }
}
