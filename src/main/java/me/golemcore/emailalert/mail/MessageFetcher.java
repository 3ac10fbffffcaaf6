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

import jakarta.mail.FetchProfile;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.StoreClosedException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.domain.model.MailCredential;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a {@link MailQuery} on an open {@link ReadSession} and materializes the
 * newest matches.
 *
 * <p>
 * The server returns matches oldest-first; the fetcher keeps the last
 * {@code limit} of them and returns those newest-first. A message that cannot
 * be decoded is logged and skipped. A failed search or a connection lost
 * mid-batch aborts the whole call with {@link MailFetchException}.
 */
@Component
@Slf4j
public class MessageFetcher {

    public static final int NO_LIMIT = Integer.MAX_VALUE;

    private final MessageDecoder decoder;
    private final MailCredential credential;

    public MessageFetcher(MessageDecoder decoder, MailCredential credential) {
        this.decoder = decoder;
        this.credential = credential;
    }

    public List<EmailMessage> fetch(ReadSession session, MailQuery query, int limit) throws MailFetchException {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        Folder folder = session.getFolder();
        String folderName = session.getFolderName();

        Message[] matches = search(folder, folderName, query);
        Message[] window = Arrays.copyOfRange(matches, Math.max(0, matches.length - limit), matches.length);
        prefetch(folder, folderName, window);

        List<EmailMessage> emails = new ArrayList<>(window.length);
        for (int i = window.length - 1; i >= 0; i--) {
            Message message = window[i];
            try {
                emails.add(decoder.decode(message));
            } catch (FolderClosedException | StoreClosedException e) {
                throw new MailFetchException("Connection lost while reading " + folderName + ": "
                        + credential.redact(e.getMessage()), e);
            } catch (MessagingException | IOException | RuntimeException e) { // NOSONAR - best-effort batch
                if (!folder.isOpen()) {
                    throw new MailFetchException(
                            "Connection lost while reading " + folderName + ": " + credential.redact(e.getMessage()),
                            e);
                }
                log.warn("[IMAP] Skipping undecodable message #{} in {}: {}",
                        message.getMessageNumber(), folderName, credential.redact(e.getMessage()));
            }
        }

        log.info("[IMAP] Fetched {} of {} matching messages in {} (query: {})",
                emails.size(), matches.length, folderName, query);
        return emails;
    }

    public int count(ReadSession session, MailQuery query) throws MailFetchException {
        Folder folder = session.getFolder();
        try {
            if (query.isMatchAll()) {
                return folder.getMessageCount();
            }
            return folder.search(query.getSearchTerm()).length;
        } catch (MessagingException e) {
            throw new MailFetchException("Search failed in " + session.getFolderName() + ": "
                    + credential.redact(e.getMessage()), e);
        }
    }

    private Message[] search(Folder folder, String folderName, MailQuery query) throws MailFetchException {
        try {
            Message[] matches = query.isMatchAll() ? folder.getMessages() : folder.search(query.getSearchTerm());
            return matches != null ? matches : new Message[0];
        } catch (MessagingException e) {
            throw new MailFetchException("Search failed in " + folderName + ": " + credential.redact(e.getMessage()),
                    e);
        }
    }

    private void prefetch(Folder folder, String folderName, Message[] window) throws MailFetchException {
        if (window.length == 0) {
            return;
        }
        FetchProfile profile = new FetchProfile();
        profile.add(FetchProfile.Item.ENVELOPE);
        profile.add(FetchProfile.Item.FLAGS);
        try {
            folder.fetch(window, profile);
        } catch (MessagingException e) {
            throw new MailFetchException("Fetch failed in " + folderName + ": " + credential.redact(e.getMessage()),
                    e);
        }
    }
}
