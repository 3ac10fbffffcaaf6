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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.model.MailCredential;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the process-wide {@link MailCredential} from {@link EmailProperties}.
 *
 * <p>
 * Missing account identity, secret or server host is a startup failure: the
 * application context refuses to start rather than failing every later call.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class MailConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MailCredential mailCredential(EmailProperties properties) {
        MailCredential credential = createCredential(properties);
        log.info("[Config] IMAP endpoint {}:{} ({}), SMTP endpoint {}:{} ({})",
                credential.imapHost(), credential.imapPort(), properties.getImap().getSecurity(),
                credential.smtpHost(), credential.smtpPort(), properties.getSmtp().getSecurity());
        return credential;
    }

    static MailCredential createCredential(EmailProperties properties) {
        require(properties.getUsername(), "email.username (EMAIL_USER)");
        require(properties.getPassword(), "email.password (EMAIL_PASS)");
        require(properties.getImap().getHost(), "email.imap.host (IMAP_SERVER)");
        require(properties.getSmtp().getHost(), "email.smtp.host (SMTP_SERVER)");

        return new MailCredential(
                properties.getUsername().trim(),
                properties.getPassword(),
                properties.getImap().getHost().trim(),
                properties.getImap().getPort(),
                properties.getSmtp().getHost().trim(),
                properties.getSmtp().getPort());
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " must be set");
        }
    }
}
