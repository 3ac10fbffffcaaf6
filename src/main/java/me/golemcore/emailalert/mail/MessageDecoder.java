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

import jakarta.mail.Address;
import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns one fetched IMAP message into an {@link EmailMessage}.
 *
 * <p>
 * Headers are decoded from RFC 2047 encoded words. The body is the first
 * {@code text/plain} part found depth-first; when there is none, the first
 * other text part is used (HTML is reduced to plain text). Attachments are
 * never read. The body is then cut to the configured preview length.
 *
 * <p>
 * Decoding only reads: it relies on the folder being open read-only and on
 * peek fetches, so the {@code \Seen} flag is reported as found.
 */
@Component
@Slf4j
public class MessageDecoder {

    static final String TRUNCATION_MARKER = "...";

    private static final int MAX_MULTIPART_DEPTH = 10;
    private static final String HEADER_FROM = "From";
    private static final String HEADER_TO = "To";
    private static final String HEADER_DATE = "Date";

    private final EmailProperties properties;

    public MessageDecoder(EmailProperties properties) {
        this.properties = properties;
    }

    public EmailMessage decode(Message message) throws MessagingException, IOException {
        return EmailMessage.builder()
                .id(String.valueOf(message.getMessageNumber()))
                .subject(nullToEmpty(message.getSubject()))
                .from(readAddresses(message, HEADER_FROM, message::getFrom))
                .to(readAddresses(message, HEADER_TO, () -> message.getRecipients(Message.RecipientType.TO)))
                .date(readHeader(message, HEADER_DATE))
                .body(truncate(extractBody(message)))
                .unread(!message.isSet(Flags.Flag.SEEN))
                .build();
    }

    // ==================== Body extraction ====================

    String extractBody(Part part) throws MessagingException, IOException {
        String plainText = findPlainText(part, 0);
        if (plainText != null) {
            return normalize(plainText);
        }
        String fallback = findFirstText(part, 0);
        return fallback != null ? normalize(fallback) : "";
    }

    private String findPlainText(Part part, int depth) throws MessagingException, IOException {
        if (depth > MAX_MULTIPART_DEPTH || isAttachment(part)) {
            return null;
        }
        if (part.isMimeType("text/plain")) {
            return readText(part);
        }
        Multipart multipart = asMultipart(part);
        if (multipart != null) {
            for (int i = 0; i < multipart.getCount(); i++) {
                String text = findPlainText(multipart.getBodyPart(i), depth + 1);
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    private String findFirstText(Part part, int depth) throws MessagingException, IOException {
        if (depth > MAX_MULTIPART_DEPTH || isAttachment(part)) {
            return null;
        }
        if (part.isMimeType("text/html")) {
            return HtmlSanitizer.stripHtml(readText(part));
        }
        if (part.isMimeType("text/*")) {
            return readText(part);
        }
        Multipart multipart = asMultipart(part);
        if (multipart != null) {
            for (int i = 0; i < multipart.getCount(); i++) {
                String text = findFirstText(multipart.getBodyPart(i), depth + 1);
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    private Multipart asMultipart(Part part) throws MessagingException, IOException {
        if (!part.isMimeType("multipart/*")) {
            return null;
        }
        Object content = part.getContent();
        return content instanceof Multipart multipart ? multipart : null;
    }

    private boolean isAttachment(Part part) throws MessagingException {
        String disposition = part.getDisposition();
        return Part.ATTACHMENT.equalsIgnoreCase(disposition)
                || (disposition != null && part.getFileName() != null);
    }

    /**
     * Reads a text part with its declared charset, falling back to UTF-8 when
     * the JVM does not know the charset.
     */
    private String readText(Part part) throws MessagingException, IOException {
        try {
            Object content = part.getContent();
            if (content instanceof String text) {
                return text;
            }
            if (content instanceof InputStream stream) {
                return readUtf8(stream);
            }
            return content != null ? content.toString() : "";
        } catch (UnsupportedEncodingException e) {
            log.debug("[IMAP] Unsupported charset, decoding as UTF-8: {}", e.getMessage());
            return readUtf8(part.getInputStream());
        }
    }

    private static String readUtf8(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String normalize(String text) {
        return text.replace("\r\n", "\n").strip();
    }

    String truncate(String body) {
        int limit = properties.getPreviewLength();
        if (limit <= 0 || body.length() <= limit) {
            return body;
        }
        int end = limit;
        if (Character.isHighSurrogate(body.charAt(end - 1))) {
            end--;
        }
        return body.substring(0, end).stripTrailing() + TRUNCATION_MARKER;
    }

    // ==================== Headers ====================

    private String readAddresses(Message message, String header, AddressSource source) throws MessagingException {
        try {
            return formatAddresses(source.get());
        } catch (AddressException e) {
            log.debug("[IMAP] Unparseable {} header, using raw value: {}", header, e.getMessage());
            return readHeader(message, header);
        }
    }

    private static String formatAddresses(Address[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return "";
        }
        return Arrays.stream(addresses)
                .filter(Objects::nonNull)
                .map(a -> a instanceof InternetAddress internet ? internet.toUnicodeString() : a.toString())
                .collect(Collectors.joining(", "));
    }

    private static String readHeader(Message message, String name) throws MessagingException {
        String[] values = message.getHeader(name);
        if (values == null || values.length == 0 || values[0] == null) {
            return "";
        }
        String unfolded = MimeUtility.unfold(values[0]).trim();
        try {
            return MimeUtility.decodeText(unfolded);
        } catch (UnsupportedEncodingException e) {
            return unfolded;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    @FunctionalInterface
    private interface AddressSource {
        Address[] get() throws MessagingException;
    }
}
