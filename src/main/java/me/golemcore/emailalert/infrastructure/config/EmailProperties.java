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

package me.golemcore.emailalert.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration of the email tool server, bound from
 * {@code application.properties} under the {@code email.*} prefix.
 *
 * <p>
 * Account identity, secret and host names have no usable defaults here;
 * {@link MailConfiguration} refuses to start without them. Ports default to
 * the standard IMAP-over-SSL (993) and SMTP submission (587) ports.
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "email")
@Data
public class EmailProperties {

    private String username = "";
    private String password = "";
    private ImapProperties imap = new ImapProperties();
    private SmtpProperties smtp = new SmtpProperties();

    /** Connect timeout for both protocols, in milliseconds. */
    private int connectTimeout = 10000;

    /** Socket read timeout for both protocols, in milliseconds. */
    private int readTimeout = 30000;

    /** Body preview length in characters; longer bodies are cut. */
    private int previewLength = 300;

    private String defaultFolder = "INBOX";
    private int defaultReadCount = 10;

    /** Upper bound on messages returned by a single read. */
    private int maxMessageLimit = 100;

    /** Upper bound on one tool call, end to end. */
    private Duration toolTimeout = Duration.ofSeconds(60);

    @Data
    public static class ImapProperties {
        private String host = "";
        private int port = 993;
        private String security = "ssl";
        private String sslTrust = "";
    }

    @Data
    public static class SmtpProperties {
        private String host = "";
        private int port = 587;
        private String security = "starttls";
        private String sslTrust = "";
    }
}
