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

import jakarta.mail.Flags;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MessageDecoderTest {

    private static final String CRLF = "\r\n";

    private EmailProperties properties;
    private MessageDecoder decoder;

    @BeforeEach
    void setUp() {
        properties = new EmailProperties();
        decoder = new MessageDecoder(properties);
    }

    // ==================== Headers ====================

    @Test
    void shouldDecodeHeadersAndPlainBody() throws Exception {
        MimeMessage message = parse(
                "From: Alice Example <alice@example.com>",
                "To: bob@example.com, carol@example.com",
                "Subject: Quarterly report",
                "Date: Mon, 1 Jan 2024 10:00:00 +0000",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "Numbers are up.");

        EmailMessage email = decoder.decode(message);

        assertEquals("Quarterly report", email.getSubject());
        assertEquals("Alice Example <alice@example.com>", email.getFrom());
        assertEquals("bob@example.com, carol@example.com", email.getTo());
        assertEquals("Mon, 1 Jan 2024 10:00:00 +0000", email.getDate());
        assertEquals("Numbers are up.", email.getBody());
        assertTrue(email.isUnread());
    }

    @Test
    void shouldDecodeEncodedWordSubjectAndSender() throws Exception {
        MimeMessage message = parse(
                "From: =?UTF-8?B?SsO8cmdlbg==?= <j@example.com>",
                "Subject: =?UTF-8?Q?Gr=C3=BC=C3=9Fe?=",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "Hallo");

        EmailMessage email = decoder.decode(message);

        assertEquals("Grüße", email.getSubject());
        assertEquals("Jürgen <j@example.com>", email.getFrom());
    }

    @Test
    void shouldUseEmptyStringsForMissingHeaders() throws Exception {
        MimeMessage message = parse(
                "Content-Type: text/plain",
                "",
                "body only");

        EmailMessage email = decoder.decode(message);

        assertEquals("", email.getSubject());
        assertEquals("", email.getFrom());
        assertEquals("", email.getTo());
        assertEquals("", email.getDate());
        assertEquals("body only", email.getBody());
    }

    @Test
    void shouldReportSeenMessageAsRead() throws Exception {
        MimeMessage message = parse(
                "Subject: seen",
                "Content-Type: text/plain",
                "",
                "text");
        message.setFlag(Flags.Flag.SEEN, true);

        assertFalse(decoder.decode(message).isUnread());
    }

    // ==================== Body ====================

    @Test
    void shouldPreferPlainTextPartInAlternative() throws Exception {
        MimeMessage message = parse(
                "Subject: alt",
                "MIME-Version: 1.0",
                "Content-Type: multipart/alternative; boundary=\"b1\"",
                "",
                "--b1",
                "Content-Type: text/html; charset=UTF-8",
                "",
                "<p>HTML version</p>",
                "--b1",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "Plain version",
                "--b1--");

        assertEquals("Plain version", decoder.decode(message).getBody());
    }

    @Test
    void shouldFallBackToStrippedHtml() throws Exception {
        MimeMessage message = parse(
                "Subject: html only",
                "MIME-Version: 1.0",
                "Content-Type: text/html; charset=UTF-8",
                "",
                "<html><body><p>Hello &amp; welcome</p></body></html>");

        assertEquals("Hello & welcome", decoder.decode(message).getBody());
    }

    @Test
    void shouldSkipAttachments() throws Exception {
        MimeMessage message = parse(
                "Subject: with attachment",
                "MIME-Version: 1.0",
                "Content-Type: multipart/mixed; boundary=\"m\"",
                "",
                "--m",
                "Content-Type: text/plain; name=\"notes.txt\"",
                "Content-Disposition: attachment; filename=\"notes.txt\"",
                "",
                "attached text",
                "--m",
                "Content-Type: multipart/alternative; boundary=\"a\"",
                "",
                "--a",
                "Content-Type: text/plain; charset=UTF-8",
                "",
                "Real body",
                "--a--",
                "--m--");

        assertEquals("Real body", decoder.decode(message).getBody());
    }

    @Test
    void shouldReturnEmptyBodyWhenNoTextPart() throws Exception {
        MimeMessage message = parse(
                "Subject: image",
                "MIME-Version: 1.0",
                "Content-Type: multipart/mixed; boundary=\"m\"",
                "",
                "--m",
                "Content-Type: image/png",
                "Content-Transfer-Encoding: base64",
                "",
                "iVBORw0KGgo=",
                "--m--");

        assertEquals("", decoder.decode(message).getBody());
    }

    // ==================== Charsets ====================

    @Test
    void shouldDecodeQuotedPrintableLatin1Body() throws Exception {
        MimeMessage message = parse(
                "From: a@example.com",
                "Subject: Menu",
                "Content-Type: text/plain; charset=ISO-8859-1",
                "Content-Transfer-Encoding: quoted-printable",
                "",
                "caf=E9");

        assertEquals("café", decoder.decode(message).getBody());
    }

    @Test
    void shouldDecodeBase64Latin1Body() throws Exception {
        MimeMessage message = parse(
                "From: a@example.com",
                "Subject: Menu",
                "Content-Type: text/plain; charset=ISO-8859-1",
                "Content-Transfer-Encoding: base64",
                "",
                "Y2Fm6Q==");

        assertEquals("café", decoder.decode(message).getBody());
    }

    @Test
    void shouldFallBackToUtf8ForUnknownCharset() throws Exception {
        MimeMessage message = parse(
                "From: a@example.com",
                "Subject: Odd charset",
                "Content-Type: text/plain; charset=x-nonexistent",
                "",
                "héllo wörld");

        assertEquals("héllo wörld", decoder.decode(message).getBody());
    }

    // ==================== Truncation ====================

    @Test
    void shouldTruncateLongBodyWithMarker() throws Exception {
        properties.setPreviewLength(10);
        MimeMessage message = parse(
                "Content-Type: text/plain",
                "",
                "abcdefghijklmnopqrstuvwxyz");

        assertEquals("abcdefghij...", decoder.decode(message).getBody());
    }

    @Test
    void shouldKeepBodyThatFitsExactly() {
        properties.setPreviewLength(5);

        assertEquals("abcde", decoder.truncate("abcde"));
    }

    @Test
    void shouldNotTruncateWhenLimitDisabled() {
        properties.setPreviewLength(0);
        String body = "x".repeat(1000);

        assertEquals(body, decoder.truncate(body));
    }

    @Test
    void shouldNotSplitSurrogatePair() {
        properties.setPreviewLength(3);

        assertEquals("ab...", decoder.truncate("ab😀cd"));
    }

    private static MimeMessage parse(String... lines) throws MessagingException, IOException {
        String raw = String.join(CRLF, lines) + CRLF;
        Session session = Session.getInstance(new Properties());
        try (ByteArrayInputStream in = new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8))) {
            return new MimeMessage(session, in);
        }
    }
}
