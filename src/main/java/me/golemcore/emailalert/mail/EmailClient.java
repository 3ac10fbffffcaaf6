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

import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.domain.model.FilterCriteria;
import me.golemcore.emailalert.domain.model.SendReceipt;
import me.golemcore.emailalert.domain.model.SendRequest;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Entry point of the mail core: read, filter, send and unread-count.
 *
 * <p>
 * Each call is one synchronous unit of work on its own session, opened at the
 * start of the call and closed on every exit path. Nothing is retried; every
 * failure reaches the caller as a {@link MailException}.
 */
@Service
@Slf4j
public class EmailClient {

    private final MailboxConnectionManager connectionManager;
    private final MailQueryTranslator queryTranslator;
    private final MessageFetcher messageFetcher;
    private final MessageComposer messageComposer;
    private final EmailProperties properties;
    private final Clock clock;

    public EmailClient(MailboxConnectionManager connectionManager, MailQueryTranslator queryTranslator,
            MessageFetcher messageFetcher, MessageComposer messageComposer, EmailProperties properties,
            Clock clock) {
        this.connectionManager = connectionManager;
        this.queryTranslator = queryTranslator;
        this.messageFetcher = messageFetcher;
        this.messageComposer = messageComposer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the {@code count} most recent messages of a folder, newest first.
     *
     * @param count
     *            number of messages, capped at {@code email.max-message-limit}
     * @param folder
     *            folder name, or null for the default folder
     */
    public List<EmailMessage> readEmails(int count, String folder) throws MailException {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, was " + count);
        }
        String folderName = resolveFolder(folder);
        int limit = Math.min(count, properties.getMaxMessageLimit());
        log.info("[IMAP] Reading {} most recent messages from {}", limit, folderName);

        try (ReadSession session = connectionManager.openReadSession(folderName)) {
            return messageFetcher.fetch(session, MailQuery.matchAll(), limit);
        }
    }

    /**
     * Returns the messages matching every given criterion, newest first.
     */
    public List<EmailMessage> filterEmails(FilterCriteria criteria) throws MailException {
        String folderName = resolveFolder(criteria.getFolder());
        MailQuery query = queryTranslator.translate(criteria);
        int limit = criteria.getLimit() != null ? criteria.getLimit() : MessageFetcher.NO_LIMIT;
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        log.info("[IMAP] Filtering {} with query: {}", folderName, query);

        try (ReadSession session = connectionManager.openReadSession(folderName)) {
            return messageFetcher.fetch(session, query, limit);
        }
    }

    /**
     * Counts messages without the {@code \Seen} flag.
     */
    public int getUnreadCount(String folder) throws MailException {
        String folderName = resolveFolder(folder);
        try (ReadSession session = connectionManager.openReadSession(folderName)) {
            int unread = messageFetcher.count(session, queryTranslator.unreadOnly());
            log.info("[IMAP] {} unread messages in {}", unread, folderName);
            return unread;
        }
    }

    /**
     * Validates and submits a message. Validation happens before connecting,
     * so an invalid request never opens an SMTP session.
     *
     * @throws MailSendException
     *             for every failure, including SMTP authentication and
     *             connection errors
     */
    public SendReceipt sendEmail(SendRequest request) throws MailSendException {
        messageComposer.validate(request);

        try (SendSession session = openSendSession()) {
            MimeMessage message = messageComposer.compose(session, request);
            messageComposer.transmit(session, message);
        }

        log.info("[SMTP] Email sent to: {}", request.getTo());
        return SendReceipt.builder()
                .to(request.getTo())
                .cc(request.hasCc() ? request.getCc() : null)
                .subject(request.getSubject())
                .sentAt(clock.instant())
                .build();
    }

    private SendSession openSendSession() throws MailSendException {
        try {
            return connectionManager.openSendSession();
        } catch (MailAuthException e) {
            throw new MailSendException(SendFailureReason.AUTHENTICATION, e.getMessage(), e);
        } catch (MailConnectException e) {
            throw new MailSendException(SendFailureReason.CONNECTION, e.getMessage(), e);
        }
    }

    private String resolveFolder(String folder) {
        return folder != null && !folder.isBlank() ? folder.trim() : properties.getDefaultFolder();
    }
}
