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
import me.golemcore.emailalert.domain.model.ToolDefinition;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import me.golemcore.emailalert.mail.EmailClient;
import me.golemcore.emailalert.mail.MailException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tool searching a folder by sender, subject and unread status. Matching is
 * done by the IMAP server.
 */
@Component
public class FilterEmailsTool extends AbstractEmailTool {

    private static final String PARAM_SENDER = "sender";
    private static final String PARAM_SUBJECT = "subject";
    private static final String PARAM_IS_UNREAD = "is_unread";
    private static final String PARAM_LIMIT = "limit";

    private final EmailProperties properties;

    public FilterEmailsTool(EmailClient emailClient, MailCredential credential, EmailProperties properties) {
        super(emailClient, credential);
        this.properties = properties;
    }

    @Override
    public EmailOperation getOperation() {
        return EmailOperation.FILTER;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Search and filter emails by sender, subject, or unread status. "
                        + "Useful for finding specific emails.")
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        SCHEMA_PROPERTIES, Map.of(
                                PARAM_SENDER, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Filter by sender email address (optional)"),
                                PARAM_SUBJECT, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Filter by subject (case-insensitive substring match) (optional)"),
                                PARAM_IS_UNREAD, Map.of(
                                        PARAM_TYPE, TYPE_BOOLEAN,
                                        SCHEMA_DESC, "Filter by unread status (optional)"),
                                PARAM_FOLDER, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Email folder to search in (default: "
                                                + properties.getDefaultFolder() + ")",
                                        SCHEMA_DEFAULT, properties.getDefaultFolder()),
                                PARAM_LIMIT, Map.of(
                                        PARAM_TYPE, TYPE_INTEGER,
                                        SCHEMA_DESC, "Return at most this many of the newest matches (optional)"))))
                .build();
    }

    @Override
    protected ToolResult run(Map<String, Object> params) throws MailException {
        String folder = getStringParam(params, PARAM_FOLDER, properties.getDefaultFolder());
        FilterCriteria criteria = FilterCriteria.builder()
                .sender(getStringParam(params, PARAM_SENDER, null))
                .subject(getStringParam(params, PARAM_SUBJECT, null))
                .readStatus(ReadStatus.fromUnreadFlag(getBooleanParam(params, PARAM_IS_UNREAD)))
                .folder(folder)
                .limit(getIntParam(params, PARAM_LIMIT, null))
                .build();

        List<EmailMessage> emails = emailClient.filterEmails(criteria);
        String filterText = describe(criteria);
        if (emails.isEmpty()) {
            return ToolResult.success(String.format("No emails found in %s matching criteria (%s).",
                    folder, filterText), toData(emails));
        }
        String heading = String.format("Found %d email(s) in %s matching criteria (%s):",
                emails.size(), folder, filterText);
        return ToolResult.success(formatMessages(heading, emails), toData(emails));
    }

    static String describe(FilterCriteria criteria) {
        List<String> filters = new ArrayList<>();
        if (criteria.hasSender()) {
            filters.add("sender: " + criteria.getSender());
        }
        if (criteria.hasSubject()) {
            filters.add("subject contains: " + criteria.getSubject());
        }
        if (criteria.getReadStatus() != ReadStatus.ANY) {
            filters.add("unread: " + (criteria.getReadStatus() == ReadStatus.UNREAD));
        }
        return filters.isEmpty() ? "no filters" : String.join(", ", filters);
    }
}
