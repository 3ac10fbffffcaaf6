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
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.ToolDefinition;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import me.golemcore.emailalert.mail.EmailClient;
import me.golemcore.emailalert.mail.MailException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Tool returning the most recent messages of a folder, newest first.
 */
@Component
public class ReadEmailsTool extends AbstractEmailTool {

    private static final String PARAM_COUNT = "count";

    private final EmailProperties properties;

    public ReadEmailsTool(EmailClient emailClient, MailCredential credential, EmailProperties properties) {
        super(emailClient, credential);
        this.properties = properties;
    }

    @Override
    public EmailOperation getOperation() {
        return EmailOperation.READ;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Read recent emails from inbox or specified folder. "
                        + "Returns a list of emails with subject, sender, date, and preview.")
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        SCHEMA_PROPERTIES, Map.of(
                                PARAM_COUNT, Map.of(
                                        PARAM_TYPE, TYPE_INTEGER,
                                        SCHEMA_DESC, "Number of emails to retrieve (default: "
                                                + properties.getDefaultReadCount() + ")",
                                        SCHEMA_DEFAULT, properties.getDefaultReadCount()),
                                PARAM_FOLDER, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Email folder to read from (default: "
                                                + properties.getDefaultFolder() + ")",
                                        SCHEMA_DEFAULT, properties.getDefaultFolder()))))
                .build();
    }

    @Override
    protected ToolResult run(Map<String, Object> params) throws MailException {
        int count = getIntParam(params, PARAM_COUNT, properties.getDefaultReadCount());
        String folder = getStringParam(params, PARAM_FOLDER, properties.getDefaultFolder());

        List<EmailMessage> emails = emailClient.readEmails(count, folder);
        if (emails.isEmpty()) {
            return ToolResult.success(String.format("No emails found in %s.", folder), toData(emails));
        }
        String heading = String.format("Found %d email(s) in %s:", emails.size(), folder);
        return ToolResult.success(formatMessages(heading, emails), toData(emails));
    }
}
