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

import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.ToolDefinition;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import me.golemcore.emailalert.mail.EmailClient;
import me.golemcore.emailalert.mail.MailException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool counting unread messages in a folder.
 */
@Component
public class UnreadCountTool extends AbstractEmailTool {

    private final EmailProperties properties;

    public UnreadCountTool(EmailClient emailClient, MailCredential credential, EmailProperties properties) {
        super(emailClient, credential);
        this.properties = properties;
    }

    @Override
    public EmailOperation getOperation() {
        return EmailOperation.UNREAD_COUNT;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Get the count of unread emails in inbox or specified folder.")
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        SCHEMA_PROPERTIES, Map.of(
                                PARAM_FOLDER, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Email folder to check (default: "
                                                + properties.getDefaultFolder() + ")",
                                        SCHEMA_DEFAULT, properties.getDefaultFolder()))))
                .build();
    }

    @Override
    protected ToolResult run(Map<String, Object> params) throws MailException {
        String folder = getStringParam(params, PARAM_FOLDER, properties.getDefaultFolder());
        int unread = emailClient.getUnreadCount(folder);
        return ToolResult.success(String.format("You have %d unread email(s) in %s.", unread, folder),
                Map.of("folder", folder, "unread", unread));
    }
}
