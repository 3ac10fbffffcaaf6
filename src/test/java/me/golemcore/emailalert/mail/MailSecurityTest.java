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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MailSecurityTest {

    @Test
    void shouldParseCaseInsensitively() {
        assertEquals(MailSecurity.SSL, MailSecurity.fromString("ssl", MailSecurity.NONE));
        assertEquals(MailSecurity.STARTTLS, MailSecurity.fromString(" StartTLS ", MailSecurity.NONE));
        assertEquals(MailSecurity.NONE, MailSecurity.fromString("NONE", MailSecurity.SSL));
    }

    @Test
    void shouldUseFallbackForBlank() {
        assertEquals(MailSecurity.SSL, MailSecurity.fromString(null, MailSecurity.SSL));
        assertEquals(MailSecurity.STARTTLS, MailSecurity.fromString("", MailSecurity.STARTTLS));
    }

    @Test
    void shouldRejectUnknownValue() {
        assertThrows(IllegalArgumentException.class, () -> MailSecurity.fromString("tls13", MailSecurity.SSL));
    }

    @Test
    void shouldMapProtocols() {
        assertEquals("imaps", MailSecurity.SSL.imapProtocol());
        assertEquals("imap", MailSecurity.STARTTLS.imapProtocol());
        assertEquals("imap", MailSecurity.NONE.imapProtocol());
        assertEquals("smtps", MailSecurity.SSL.smtpProtocol());
        assertEquals("smtp", MailSecurity.STARTTLS.smtpProtocol());
    }
}
