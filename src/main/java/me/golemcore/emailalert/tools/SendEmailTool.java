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
import me.golemcore.emailalert.domain.model.SendReceipt;
import me.golemcore.emailalert.domain.model.SendRequest;
import me.golemcore.emailalert.domain.model.ToolDefinition;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.mail.EmailClient;
import me.golemcore.emailalert.mail.MailException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool sending a plain-text email from the configured account.
 *
 * <p>
 * The From address is always the configured username; the agent cannot spoof
 * the sender.
 */
@Component
public class SendEmailTool extends AbstractEmailTool {

    private static final String PARAM_TO = "to";
    private static final String PARAM_SUBJECT = "subject";
    private static final String PARAM_BODY = "body";
    private static final String PARAM_CC = "cc";

    public SendEmailTool(EmailClient emailClient, MailCredential credential) {
        super(emailClient, credential);
    }

    @Override
    public EmailOperation getOperation() {
        return EmailOperation.SEND;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Send an email to a recipient with subject and body. Can optionally include CC.")
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        SCHEMA_PROPERTIES, Map.of(
                                PARAM_TO, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Recipient email address (comma-separated for several)"),
                                PARAM_SUBJECT, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Email subject line"),
                                PARAM_BODY, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "Email body content (plain text)"),
                                PARAM_CC, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        SCHEMA_DESC, "CC recipient email address (optional)")),
                        "required", List.of(PARAM_TO, PARAM_SUBJECT, PARAM_BODY)))
                .build();
    }

    @Override
    protected ToolResult run(Map<String, Object> params) throws MailException {
        SendRequest request = SendRequest.builder()
                .to(getStringParam(params, PARAM_TO, null))
                .subject(getStringParam(params, PARAM_SUBJECT, null))
                .body(params.get(PARAM_BODY) instanceof String body ? body : null)
                .cc(getStringParam(params, PARAM_CC, null))
                .build();

        SendReceipt receipt = emailClient.sendEmail(request);

        StringBuilder sb = new StringBuilder();
        sb.append("Email sent successfully!\n\n");
        sb.append(String.format("To: %s%n", receipt.getTo()));
        if (receipt.getCc() != null) {
            sb.append(String.format("CC: %s%n", receipt.getCc()));
        }
        sb.append(String.format("Subject: %s%n", receipt.getSubject()));
        sb.append(String.format("Sent at: %s", receipt.getSentAt()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PARAM_TO, receipt.getTo());
        data.put(PARAM_CC, receipt.getCc());
        data.put(PARAM_SUBJECT, receipt.getSubject());
        data.put("timestamp", receipt.getSentAt().toString());
        return ToolResult.success(sb.toString(), data);
    }
}
