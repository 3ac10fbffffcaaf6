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

package me.golemcore.emailalert.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.emailalert.domain.component.ToolComponent;
import me.golemcore.emailalert.domain.model.MailCredential;
import me.golemcore.emailalert.domain.model.ToolDefinition;
import me.golemcore.emailalert.domain.model.ToolFailureKind;
import me.golemcore.emailalert.domain.model.ToolResult;
import me.golemcore.emailalert.infrastructure.config.EmailProperties;
import me.golemcore.emailalert.tools.AbstractEmailTool;
import me.golemcore.emailalert.tools.EmailOperation;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Dispatches tool calls by name to the registered {@link ToolComponent}s and
 * bounds each call by the configured tool timeout.
 *
 * <p>
 * Never throws: unknown tools, disabled tools, timeouts and unexpected errors
 * all come back as {@link ToolResult} failures. Failure text is redacted with
 * the account {@link MailCredential}.
 */
@Component
@Slf4j
public class ToolCallExecutionService {

    private final Map<EmailOperation, ToolComponent> toolRegistry;
    private final EmailProperties properties;
    private final MailCredential credential;

    public ToolCallExecutionService(List<AbstractEmailTool> tools, EmailProperties properties,
            MailCredential credential) {
        this.toolRegistry = new EnumMap<>(EmailOperation.class);
        this.properties = properties;
        this.credential = credential;
        for (AbstractEmailTool tool : tools) {
            ToolComponent previous = toolRegistry.put(tool.getOperation(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool for operation: " + tool.getToolName());
            }
        }
        log.info("[Tools] Registered tools: {}", availableTools());
    }

    public ToolResult execute(String name, Map<String, Object> arguments) {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = EmailOperation.fromToolName(toolName)
                .map(toolRegistry::get)
                .orElse(null);

        if (tool == null) {
            String available = availableTools();
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + toolName + ". Available tools: " + available);
        }

        if (!tool.isEnabled()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + toolName);
        }

        Duration timeout = properties.getToolTimeout();
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result: " + toolName);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {}", toolName, timeout);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution timed out after " + timeout.toMillis() + " ms: " + toolName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted: " + toolName);
        } catch (ExecutionException | RuntimeException e) {
            String reason = credential.redact(safeCauseMessage(e));
            log.error("[Tools] Tool execution failed: {}: {}", toolName, reason);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + reason);
        }
    }

    public List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : toolRegistry.values()) {
            if (tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    private String availableTools() {
        return toolRegistry.values().stream()
                .map(ToolComponent::getToolName)
                .collect(Collectors.joining(", "));
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strips trailing garbage such as leaked special tokens from tool names.
     */
    static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.trim().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
