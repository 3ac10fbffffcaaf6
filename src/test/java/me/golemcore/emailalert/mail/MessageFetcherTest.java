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
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.search.SearchTerm;
import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.domain.model.FilterCriteria;
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.ReadStatus;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@SuppressWarnings({ "PMD.CloseResource" }) // mock folders and stores don't need closing
class MessageFetcherTest {

    private static final String INBOX = "INBOX";
    private static final String USERNAME = "reader@example.com";
    private static final String PASSWORD = "imap-secret";
    private static final MailCredential CREDENTIAL = new MailCredential(USERNAME, PASSWORD,
            "imap.example.com", 993, "smtp.example.com", 587);

    private Folder folder;
    private ReadSession session;
    private MailQueryTranslator translator;

    @BeforeEach
    void setUp() {
        folder = mock(Folder.class);
        when(folder.getFullName()).thenReturn(INBOX);
        when(folder.isOpen()).thenReturn(true);
        session = new ReadSession(mock(Store.class), folder);
        translator = new MailQueryTranslator();
    }

    // ==================== Ordering and limit ====================

    @Test
    void shouldReturnNewestMessagesFirst() throws Exception {
        Message[] messages = messages(20);
        when(folder.getMessages()).thenReturn(messages);
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        List<EmailMessage> emails = fetcher.fetch(session, MailQuery.matchAll(), 5);

        assertEquals(List.of("20", "19", "18", "17", "16"), emails.stream().map(EmailMessage::getId).toList());
    }

    @Test
    void shouldReturnAllWhenFewerThanLimit() throws Exception {
        when(folder.getMessages()).thenReturn(messages(3));
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        List<EmailMessage> emails = fetcher.fetch(session, MailQuery.matchAll(), 10);

        assertEquals(List.of("3", "2", "1"), emails.stream().map(EmailMessage::getId).toList());
    }

    @Test
    void shouldReturnEmptyListForEmptyFolder() throws Exception {
        when(folder.getMessages()).thenReturn(new Message[0]);
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        List<EmailMessage> emails = fetcher.fetch(session, MailQuery.matchAll(), 10);

        assertTrue(emails.isEmpty());
        verify(folder, never()).fetch(any(), any());
    }

    @Test
    void shouldPrefetchOnlyTheWindow() throws Exception {
        when(folder.getMessages()).thenReturn(messages(20));
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        fetcher.fetch(session, MailQuery.matchAll(), 5);

        verify(folder).fetch(argThat(window -> window.length == 5 && window[0].getMessageNumber() == 16),
                any(FetchProfile.class));
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        assertThrows(IllegalArgumentException.class, () -> fetcher.fetch(session, MailQuery.matchAll(), 0));
    }

    // ==================== Read-only ====================

    @Test
    void shouldNotChangeSeenFlagWhileReading() throws Exception {
        Message[] messages = messages(4);
        when(folder.getMessages()).thenReturn(messages);
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        List<EmailMessage> emails = fetcher.fetch(session, MailQuery.matchAll(), 4);

        assertTrue(emails.stream().allMatch(EmailMessage::isUnread));
        for (Message message : messages) {
            verify(message, never()).setFlag(any(Flags.Flag.class), anyBoolean());
            verify(message, never()).setFlags(any(Flags.class), anyBoolean());
        }
    }

    // ==================== Search ====================

    @Test
    void shouldRunServerSideSearchForFilteredQuery() throws Exception {
        MailQuery query = translator.translate(FilterCriteria.builder()
                .sender("alice@example.com")
                .readStatus(ReadStatus.UNREAD)
                .build());
        when(folder.search(query.getSearchTerm())).thenReturn(messages(2));
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        List<EmailMessage> emails = fetcher.fetch(session, query, MessageFetcher.NO_LIMIT);

        assertEquals(2, emails.size());
        verify(folder, never()).getMessages();
    }

    @Test
    void shouldFailWhenSearchFails() throws Exception {
        when(folder.search(any(SearchTerm.class))).thenThrow(new MessagingException("BAD"));
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        MailFetchException e = assertThrows(MailFetchException.class,
                () -> fetcher.fetch(session, translator.unreadOnly(), 10));

        assertTrue(e.getMessage().contains("Search failed in INBOX"));
        assertEquals(MailFailureKind.FETCH, e.getKind());
    }

    @Test
    void shouldRedactCredentialsFromSearchFailure() throws Exception {
        when(folder.search(any(SearchTerm.class)))
                .thenThrow(new MessagingException("NO [ALERT] session for " + USERNAME + " expired"));
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        MailFetchException e = assertThrows(MailFetchException.class,
                () -> fetcher.fetch(session, translator.unreadOnly(), 10));

        assertFalse(e.getMessage().contains(USERNAME));
        assertTrue(e.getMessage().contains("session for ***"));
    }

    @Test
    void shouldRedactCredentialsWhenConnectionLostMidBatch() throws Exception {
        Message[] messages = messages(1);
        when(folder.getMessages()).thenReturn(messages);
        MessageDecoder decoder = mock(MessageDecoder.class);
        when(decoder.decode(messages[0])).thenThrow(new FolderClosedException(folder, "BYE " + PASSWORD));
        MessageFetcher fetcher = new MessageFetcher(decoder, CREDENTIAL);

        MailFetchException e = assertThrows(MailFetchException.class,
                () -> fetcher.fetch(session, MailQuery.matchAll(), 10));

        assertFalse(e.getMessage().contains(PASSWORD));
    }

    // ==================== Decode failures ====================

    @Test
    void shouldSkipMessageThatCannotBeDecoded() throws Exception {
        Message[] messages = messages(3);
        when(folder.getMessages()).thenReturn(messages);
        MessageDecoder decoder = mock(MessageDecoder.class);
        when(decoder.decode(messages[0])).thenReturn(email("1"));
        when(decoder.decode(messages[1])).thenThrow(new MessagingException("corrupt MIME"));
        when(decoder.decode(messages[2])).thenReturn(email("3"));
        MessageFetcher fetcher = new MessageFetcher(decoder, CREDENTIAL);

        List<EmailMessage> emails = fetcher.fetch(session, MailQuery.matchAll(), 10);

        assertEquals(List.of("3", "1"), emails.stream().map(EmailMessage::getId).toList());
    }

    @Test
    void shouldAbortWhenFolderClosesMidBatch() throws Exception {
        Message[] messages = messages(3);
        when(folder.getMessages()).thenReturn(messages);
        MessageDecoder decoder = mock(MessageDecoder.class);
        when(decoder.decode(messages[2])).thenReturn(email("3"));
        when(decoder.decode(messages[1])).thenThrow(new FolderClosedException(folder, "BYE"));
        MessageFetcher fetcher = new MessageFetcher(decoder, CREDENTIAL);

        MailFetchException e = assertThrows(MailFetchException.class,
                () -> fetcher.fetch(session, MailQuery.matchAll(), 10));

        assertTrue(e.getMessage().contains("Connection lost"));
    }

    @Test
    void shouldAbortWhenFolderNoLongerOpen() throws Exception {
        Message[] messages = messages(2);
        when(folder.getMessages()).thenReturn(messages);
        when(folder.isOpen()).thenReturn(false);
        MessageDecoder decoder = mock(MessageDecoder.class);
        when(decoder.decode(any())).thenThrow(new IllegalStateException("Folder is not Open"));
        MessageFetcher fetcher = new MessageFetcher(decoder, CREDENTIAL);

        assertThrows(MailFetchException.class, () -> fetcher.fetch(session, MailQuery.matchAll(), 10));
    }

    // ==================== Count ====================

    @Test
    void shouldCountUnreadWithServerSearch() throws Exception {
        MailQuery unread = translator.unreadOnly();
        when(folder.getMessageCount()).thenReturn(12);
        when(folder.search(unread.getSearchTerm())).thenReturn(messages(3));
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        assertEquals(3, fetcher.count(session, unread));
    }

    @Test
    void shouldCountAllWithoutSearch() throws Exception {
        when(folder.getMessageCount()).thenReturn(12);
        MessageFetcher fetcher = new MessageFetcher(new MessageDecoder(new EmailProperties()), CREDENTIAL);

        assertEquals(12, fetcher.count(session, MailQuery.matchAll()));
        verify(folder, never()).search(any());
    }

    private static Message[] messages(int count) {
        Message[] messages = new Message[count];
        for (int i = 0; i < count; i++) {
            Message message = mock(Message.class);
            when(message.getMessageNumber()).thenReturn(i + 1);
            messages[i] = message;
        }
        return messages;
    }

    private static EmailMessage email(String id) {
        return EmailMessage.builder().id(id).build();
    }
}
