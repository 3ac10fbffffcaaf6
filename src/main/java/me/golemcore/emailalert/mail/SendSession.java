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

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Authenticated SMTP connection used for exactly one submission.
 *
 * <p>
 * {@link #close()} is idempotent and never throws.
 */
@Slf4j
public final class SendSession implements AutoCloseable {

    private final Session mailSession;
    private final Transport transport;
    private final String sender;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SendSession(Session mailSession, Transport transport, String sender) {
        this.mailSession = mailSession;
        this.transport = transport;
        this.sender = sender;
    }

    public Session getMailSession() {
        return mailSession;
    }

    public Transport getTransport() {
        return transport;
    }

    /**
     * Address of the authenticated account; always used as From.
     */
    public String getSender() {
        return sender;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            transport.close();
        } catch (MessagingException | IllegalStateException e) {
            log.debug("[SMTP] Ignoring error while closing transport: {}", e.getMessage());
        }
    }
}
