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
 * Raised when an outgoing message fails validation or transmission. Every send
 * failure, including SMTP authentication and connection problems, surfaces as
 * this single type with a {@link SendFailureReason}.
 */
public class MailSendException extends MailException {

    private static final long serialVersionUID = 1L;

    private final SendFailureReason reason;

    public MailSendException(SendFailureReason reason, String message) {
        super(message, null);
        this.reason = reason;
    }

    public MailSendException(SendFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public SendFailureReason getReason() {
        return reason;
    }

    @Override
    public MailFailureKind getKind() {
        return MailFailureKind.SEND;
    }

    @Override
    public boolean isRetryable() {
        return reason == SendFailureReason.CONNECTION;
    }
}
