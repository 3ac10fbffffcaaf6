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
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.SendRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates, builds and submits outgoing plain-text messages.
 *
 * <p>
 * The From address is always the authenticated account; callers cannot spoof
 * the sender. Validation runs before any network access, so a request with a
 * missing field or a malformed address never reaches the SMTP server.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // jakarta.mail.internet.MimeMessage.setSentDate requires java.util.Date
public class MessageComposer {

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    private static final String CONTENT_TYPE = "text/plain; charset=UTF-8";
    private static final String CHARSET = "UTF-8";

    private final Clock clock;
    private final MailCredential credential;

    public MessageComposer(Clock clock, MailCredential credential) {
        this.clock = clock;
        this.credential = credential;
    }

    /**
     * Checks required fields and recipient syntax.
     *
     * @throws MailSendException
     *             with {@link SendFailureReason#MISSING_FIELD} or
     *             {@link SendFailureReason#INVALID_RECIPIENT}
     */
    public void validate(SendRequest request) throws MailSendException {
        requireText(request.getTo(), "to");
        requireText(request.getSubject(), "subject");
        requireText(request.getBody(), "body");

        validateRecipients(request.getTo());
        if (request.hasCc()) {
            validateRecipients(request.getCc());
        }
    }

    void validateRecipients(String recipients) throws MailSendException {
        List<String> invalid = new ArrayList<>();
        for (String address : recipients.split(",")) {
            String trimmed = address.trim();
            if (!EMAIL_PATTERN.matcher(trimmed).matches() || !parsesStrictly(trimmed)) {
                invalid.add(trimmed);
            }
        }
        if (!invalid.isEmpty()) {
            throw new MailSendException(SendFailureReason.INVALID_RECIPIENT,
                    "Invalid recipient address: " + String.join(", ", invalid));
        }
    }

    /**
     * Builds the MIME message for an already validated request.
     */
    public MimeMessage compose(SendSession session, SendRequest request) throws MailSendException {
        try {
            MimeMessage message = new MimeMessage(session.getMailSession());
            message.setFrom(new InternetAddress(session.getSender()));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(request.getTo(), true));
            if (request.hasCc()) {
                message.setRecipients(Message.RecipientType.CC, InternetAddress.parse(request.getCc(), true));
            }
            message.setSubject(request.getSubject(), CHARSET);
            message.setContent(request.getBody(), CONTENT_TYPE);
            message.setSentDate(Date.from(clock.instant()));
            message.saveChanges();
            return message;
        } catch (AddressException e) {
            throw new MailSendException(SendFailureReason.INVALID_RECIPIENT,
                    "Invalid recipient address: " + credential.redact(e.getMessage()), e);
        } catch (MessagingException e) {
            throw new MailSendException(SendFailureReason.TRANSPORT,
                    "Could not build message: " + credential.redact(e.getMessage()), e);
        }
    }

    /**
     * Submits the message to every To and Cc recipient over the session's
     * transport.
     */
    public void transmit(SendSession session, MimeMessage message) throws MailSendException {
        try {
            session.getTransport().sendMessage(message, message.getAllRecipients());
            log.info("[SMTP] Message accepted for {}", formatAddresses(message.getAllRecipients()));
        } catch (SendFailedException e) {
            Address[] invalid = e.getInvalidAddresses();
            if (invalid != null && invalid.length > 0) {
                throw new MailSendException(SendFailureReason.INVALID_RECIPIENT,
                        "Invalid recipient address: " + formatAddresses(invalid), e);
            }
            throw new MailSendException(SendFailureReason.TRANSPORT, "SMTP server rejected the message: "
                    + credential.redact(e.getMessage()), e);
        } catch (AuthenticationFailedException e) {
            throw new MailSendException(SendFailureReason.AUTHENTICATION,
                    "SMTP authentication failed: " + credential.redact(e.getMessage()), e);
        } catch (MessagingException e) {
            throw new MailSendException(SendFailureReason.TRANSPORT,
                    "SMTP error: " + credential.redact(e.getMessage()), e);
        }
    }

    private static void requireText(String value, String name) throws MailSendException {
        if (value == null || value.isBlank()) {
            throw new MailSendException(SendFailureReason.MISSING_FIELD, "Missing required parameter: " + name);
        }
    }

    private static boolean parsesStrictly(String address) {
        try {
            new InternetAddress(address, true).validate();
            return true;
        } catch (AddressException e) {
            return false;
        }
    }

    private static String formatAddresses(Address[] addresses) {
        if (addresses == null) {
            return "";
        }
        return Arrays.stream(addresses).map(Address::toString).collect(Collectors.joining(", "));
    }
}
