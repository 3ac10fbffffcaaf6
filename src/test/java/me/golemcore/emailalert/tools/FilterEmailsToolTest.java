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

package me.golemcore.emailalert.tools;

import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.domain.model.FilterCriteria;
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.ReadStatus;
import me.golemcore.emailalert.domain.model.ToolFailureKind;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import me.golemcore.emailalert.mail.EmailClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FilterEmailsToolTest {

    private EmailClient emailClient;
    private FilterEmailsTool tool;

    @BeforeEach
    void setUp() {
        emailClient = mock(EmailClient.class);
        tool = new FilterEmailsTool(emailClient,
                new MailCredential("me@example.com", "s3cr3t", "imap.example.com", 993, "smtp.example.com", 587),
                new EmailProperties());
    }

    @Test
    void shouldBuildCriteriaFromParameters() throws Exception {
        when(emailClient.filterEmails(any())).thenReturn(List.of(EmailMessage.builder()
                .id("7").from("boss@corp.com").subject("Deadline").unread(true).build()));

        ToolResult result = tool.execute(Map.of(
                "sender", "boss@corp.com",
                "subject", "deadline",
                "is_unread", true,
                "limit", 5)).get();

        ArgumentCaptor<FilterCriteria> captor = ArgumentCaptor.forClass(FilterCriteria.class);
        verify(emailClient).filterEmails(captor.capture());
        FilterCriteria criteria = captor.getValue();
        assertEquals("boss@corp.com", criteria.getSender());
        assertEquals("deadline", criteria.getSubject());
        assertEquals(ReadStatus.UNREAD, criteria.getReadStatus());
        assertEquals("INBOX", criteria.getFolder());
        assertEquals(5, criteria.getLimit());

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Found 1 email(s) in INBOX matching criteria "
                + "(sender: boss@corp.com, subject contains: deadline, unread: true):"));
    }

    @Test
    void shouldTreatFalseUnreadFlagAsReadOnly() throws Exception {
        when(emailClient.filterEmails(any())).thenReturn(List.of());

        tool.execute(Map.of("is_unread", "false")).get();

        ArgumentCaptor<FilterCriteria> captor = ArgumentCaptor.forClass(FilterCriteria.class);
        verify(emailClient).filterEmails(captor.capture());
        assertEquals(ReadStatus.READ, captor.getValue().getReadStatus());
        assertNull(captor.getValue().getLimit());
    }

    @Test
    void shouldDescribeEmptyCriteria() throws Exception {
        when(emailClient.filterEmails(any())).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("folder", "Archive")).get();

        assertTrue(result.isSuccess());
        assertEquals("No emails found in Archive matching criteria (no filters).", result.getOutput());
    }

    @Test
    void shouldRejectInvalidBooleanFlag() throws Exception {
        ToolResult result = tool.execute(Map.of("is_unread", "maybe")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        verifyNoInteractions(emailClient);
    }

    @Test
    void shouldDescribeOnlyActiveFilters() {
        assertEquals("sender: a@x.com", FilterEmailsTool.describe(FilterCriteria.builder()
                .sender("a@x.com").build()));
        assertEquals("unread: false", FilterEmailsTool.describe(FilterCriteria.builder()
                .readStatus(ReadStatus.READ).build()));
    }
}
