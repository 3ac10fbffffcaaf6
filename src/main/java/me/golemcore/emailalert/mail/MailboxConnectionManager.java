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

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import jakarta.mail.Transport;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import org.springframework.stereotype.Component;

/**
 * Opens short-lived authenticated sessions to the IMAP and SMTP servers.
 *
 * <p>
 * Every call performs exactly one connection attempt and reports failure
 * immediately; retry policy belongs to the caller. Sessions are never pooled:
 * IMAP folder selection and authentication are connection-scoped, so each
 * operation gets its own connection and must close it (see
 * {@link ReadSession}, {@link SendSession}).
 */
@Component
@Slf4j
@SuppressWarnings({ "PMD.CloseResource" }) // ownership of Store/Transport passes to the returned session
public class MailboxConnectionManager {

    private final MailCredential credential;
    private final EmailProperties properties;
    private final MailSecurity imapSecurity;
    private final MailSecurity smtpSecurity;

    public MailboxConnectionManager(MailCredential credential, EmailProperties properties) {
        this.credential = credential;
        this.properties = properties;
        this.imapSecurity = MailSecurity.fromString(properties.getImap().getSecurity(), MailSecurity.SSL);
        this.smtpSecurity = MailSecurity.fromString(properties.getSmtp().getSecurity(), MailSecurity.STARTTLS);
    }

    /**
     * Connects and authenticates to the IMAP server and opens the given folder
     * read-only.
     *
     * @param folderName
     *            folder to select
     * @return open session; the caller must close it
     * @throws MailAuthException
     *             if the server rejects the credentials
     * @throws MailConnectException
     *             if the server cannot be reached
     * @throws MailFolderException
     *             if the folder does not exist or cannot be opened
     */
    public ReadSession openReadSession(String folderName) throws MailException {
        Store store = connectImap();
        try {
            Folder folder = selectFolder(store, folderName);
            log.debug("[IMAP] Session opened on {}", folderName);
            return new ReadSession(store, folder);
        } catch (MailException | RuntimeException e) {
            closeStore(store);
            throw e;
        }
    }

    /**
     * Connects and authenticates to the SMTP server.
     *
     * @return open session; the caller must close it
     * @throws MailAuthException
     *             if the server rejects the credentials
     * @throws MailConnectException
     *             if the server cannot be reached or TLS negotiation fails
     */
    public SendSession openSendSession() throws MailAuthException, MailConnectException {
        Session session = MailSessionFactory.createSmtpSession(
                credential.smtpHost(), credential.smtpPort(),
                credential.username(), credential.password(),
                smtpSecurity, properties.getSmtp().getSslTrust(),
                properties.getConnectTimeout(), properties.getReadTimeout());
        try {
            Transport transport = connectTransport(session);
            log.debug("[SMTP] Session opened on {}:{}", credential.smtpHost(), credential.smtpPort());
            return new SendSession(session, transport, credential.username());
        } catch (AuthenticationFailedException e) {
            throw new MailAuthException("SMTP authentication failed: " + describe(e), e);
        } catch (MessagingException e) {
            throw new MailConnectException(String.format("Cannot connect to SMTP server %s:%d: %s",
                    credential.smtpHost(), credential.smtpPort(), describe(e)), e);
        }
    }

    Store connectStore() throws MessagingException {
        Session session = MailSessionFactory.createImapSession(
                credential.imapHost(), credential.imapPort(),
                credential.username(), credential.password(),
                imapSecurity, properties.getImap().getSslTrust(),
                properties.getConnectTimeout(), properties.getReadTimeout());

        Store store = session.getStore(imapSecurity.imapProtocol());
        store.connect(credential.imapHost(), credential.imapPort(), credential.username(), credential.password());
        return store;
    }

    Transport connectTransport(Session session) throws MessagingException {
        Transport transport = session.getTransport(smtpSecurity.smtpProtocol());
        transport.connect(credential.smtpHost(), credential.smtpPort(), credential.username(),
                credential.password());
        return transport;
    }

    /**
     * Builds a caller-facing reason from a Jakarta Mail failure, including the
     * underlying cause (e.g. {@code UnknownHostException}) and with credentials
     * removed.
     */
    String describe(MessagingException e) {
        String message = e.getMessage();
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null
                && (message == null || !message.contains(cause.getMessage()))) {
            message = (message == null ? "" : message + " ") + "(" + cause.getClass().getSimpleName() + ": "
                    + cause.getMessage() + ")";
        }
        return credential.redact(message);
    }

    private Store connectImap() throws MailAuthException, MailConnectException {
        try {
            return connectStore();
        } catch (AuthenticationFailedException e) {
            throw new MailAuthException("IMAP authentication failed: " + describe(e), e);
        } catch (MessagingException e) {
            throw new MailConnectException(String.format("Cannot connect to IMAP server %s:%d: %s",
                    credential.imapHost(), credential.imapPort(), describe(e)), e);
        }
    }

    private Folder selectFolder(Store store, String folderName) throws MailException {
        Folder folder;
        try {
            folder = store.getFolder(folderName);
            if (!folder.exists()) {
                throw new MailFolderException("Folder not found: " + folderName);
            }
        } catch (StoreClosedException e) {
            throw new MailConnectException("IMAP connection lost while selecting folder " + folderName
                    + ": " + describe(e), e);
        } catch (MessagingException e) {
            throw new MailFolderException("Cannot access folder " + folderName + ": " + describe(e), e);
        }

        try {
            folder.open(Folder.READ_ONLY);
        } catch (FolderClosedException | StoreClosedException e) {
            throw new MailConnectException("IMAP connection lost while selecting folder " + folderName
                    + ": " + describe(e), e);
        } catch (MessagingException e) {
            throw new MailFolderException("Folder cannot be selected: " + folderName + " (" + describe(e) + ")", e);
        }
        return folder;
    }

    private void closeStore(Store store) {
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("[IMAP] Ignoring error while closing store: {}", e.getMessage());
        }
    }
}
