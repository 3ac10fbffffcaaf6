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

package me.golemcore.emailalert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Email Alert tool server.
 *
 * <p>
 * Exposes four email tools to a tool-calling agent:
 * <ul>
 * <li><b>read_emails</b> - most recent messages of a folder</li>
 * <li><b>filter_emails</b> - messages matching sender / subject / unread
 * criteria</li>
 * <li><b>send_email</b> - plain-text message with optional CC</li>
 * <li><b>get_unread_count</b> - number of unread messages in a folder</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Tool layer     → ToolCallExecutionService, *EmailsTool
 * Mail core      → EmailClient, MailboxConnectionManager, MailQueryTranslator,
 *                  MessageFetcher, MessageDecoder, MessageComposer
 * Infrastructure → EmailProperties, MailConfiguration
 * </pre>
 *
 * <h2>Integration</h2>
 * <p>
 * No transport is bundled and {@code spring.main.web-application-type=none},
 * so running this class alone starts the context and exits. An outer
 * transport (a stdio or RPC adapter) embeds the context and drives
 * {@link me.golemcore.emailalert.domain.service.ToolCallExecutionService}:
 * {@code getDefinitions()} to advertise the tools and
 * {@code execute(name, arguments)} to run a call.
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code email.*} prefix, with {@code EMAIL_USER}, {@code EMAIL_PASS},
 * {@code IMAP_SERVER}, {@code IMAP_PORT}, {@code SMTP_SERVER} and
 * {@code SMTP_PORT} environment overrides.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EmailAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailAlertApplication.class, args);
    }

}
