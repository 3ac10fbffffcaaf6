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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.component.ToolComponent;
import me.golemcore.emailalert.domain.model.EmailMessage;
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.ToolFailureKind;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.mail.EmailClient;
import me.golemcore.emailalert.mail.MailException;
import me.golemcore.emailalert.mail.MailSendException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Shared plumbing of the email tools: asynchronous execution, parameter
 * coercion, mapping of mail failures onto {@link ToolResult} failures, and
 * rendering of message lists.
 *
 * <p>
 * A tool never completes exceptionally; every failure becomes a
 * {@link ToolResult#failure} whose error text is the mail core's reason.
 * Error text that did not come from the mail core is passed through
 * {@link MailCredential#redact} before it is returned or logged.
 */
@Slf4j
public abstract class AbstractEmailTool implements ToolComponent {

    protected static final String PARAM_TYPE = "type";
    protected static final String TYPE_STRING = "string";
    protected static final String TYPE_INTEGER = "integer";
    protected static final String TYPE_BOOLEAN = "boolean";
    protected static final String TYPE_OBJECT = "object";
    protected static final String SCHEMA_DESC = "description";
    protected static final String SCHEMA_PROPERTIES = "properties";
    protected static final String SCHEMA_DEFAULT = "default";

    protected static final String PARAM_FOLDER = "folder";

    private static final String ENTRY_INDENT = "   ";
    private static final String UNREAD_MARKER = " [UNREAD]";

    protected final EmailClient emailClient;
    private final MailCredential credential;

    protected AbstractEmailTool(EmailClient emailClient, MailCredential credential) {
        this.emailClient = emailClient;
        this.credential = credential;
    }

    /**
     * Operation implemented by this tool.
     */
    public abstract EmailOperation getOperation();

    @Override
    public String getToolName() {
        return getOperation().getToolName();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        return CompletableFuture.supplyAsync(() -> {
            log.info("[Tools] Executing {}", getToolName());
            try {
                return run(params);
            } catch (MailException e) {
                log.warn("[Tools] {} failed ({}, retryable={}): {}", getToolName(), e.getKind(), e.isRetryable(),
                        e.getMessage());
                return ToolResult.failure(toFailureKind(e), e.getMessage());
            } catch (IllegalArgumentException e) {
                String reason = credential.redact(e.getMessage());
                log.warn("[Tools] {} rejected arguments: {}", getToolName(), reason);
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, reason);
            } catch (Exception e) { // NOSONAR - catch broadly for I/O layer
                String reason = credential.redact(e.getMessage());
                log.error("[Tools] {} error ({}): {}", getToolName(), e.getClass().getSimpleName(), reason);
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Email error: " + reason);
            }
        });
    }

    protected abstract ToolResult run(Map<String, Object> params) throws MailException;

    static ToolFailureKind toFailureKind(MailException e) {
        if (e instanceof MailSendException sendError) {
            return switch (sendError.getReason()) {
            case MISSING_FIELD, INVALID_RECIPIENT -> ToolFailureKind.INVALID_ARGUMENTS;
            case AUTHENTICATION -> ToolFailureKind.AUTHENTICATION_FAILED;
            case CONNECTION -> ToolFailureKind.CONNECTION_FAILED;
            case TRANSPORT -> ToolFailureKind.EXECUTION_FAILED;
            };
        }
        return switch (e.getKind()) {
        case CONNECT -> ToolFailureKind.CONNECTION_FAILED;
        case AUTH -> ToolFailureKind.AUTHENTICATION_FAILED;
        case FOLDER, FETCH, SEND -> ToolFailureKind.EXECUTION_FAILED;
        };
    }

    // ==================== Rendering ====================

    /**
     * Renders a numbered list of messages under the given heading.
     */
    protected static String formatMessages(String heading, List<EmailMessage> emails) {
        StringBuilder sb = new StringBuilder();
        sb.append(heading).append("\n\n");
        int index = 1;
        for (EmailMessage email : emails) {
            sb.append(String.format("%d. From: %s%s%n", index++, email.getFrom(),
                    email.isUnread() ? UNREAD_MARKER : ""));
            sb.append(String.format("%sSubject: %s%n", ENTRY_INDENT, email.getSubject()));
            sb.append(String.format("%sDate: %s%n", ENTRY_INDENT, email.getDate()));
            sb.append(String.format("%sPreview: %s%n%n", ENTRY_INDENT, toPreviewLine(email.getBody())));
        }
        return sb.toString().stripTrailing();
    }

    protected static Map<String, Object> toData(List<EmailMessage> emails) {
        List<Map<String, Object>> messages = new ArrayList<>(emails.size());
        for (EmailMessage email : emails) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("id", email.getId());
            info.put("from", email.getFrom());
            info.put("to", email.getTo());
            info.put("subject", email.getSubject());
            info.put("date", email.getDate());
            info.put("body", email.getBody());
            info.put("is_unread", email.isUnread());
            messages.add(info);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messages", messages);
        data.put("count", emails.size());
        return data;
    }

    private static String toPreviewLine(String body) {
        return body.replaceAll("\\s+", " ").trim();
    }

    // ==================== Parameters ====================

    protected static String getStringParam(Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        if (value instanceof String s && !s.isBlank()) {
            return s.trim();
        }
        return defaultValue;
    }

    protected static Integer getIntParam(Map<String, Object> params, String key, Integer defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter " + key + " must be an integer", e);
            }
        }
        return defaultValue;
    }

    protected static Boolean getBooleanParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equals(normalized)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("Parameter " + key + " must be true or false");
        }
        return null;
    }
}
