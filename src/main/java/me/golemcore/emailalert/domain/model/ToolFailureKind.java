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

package me.golemcore.emailalert.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * Tool execution was denied by policy (e.g. tool unknown or disabled).
     */
    POLICY_DENIED,

    /**
     * Tool arguments were missing or malformed; the call never reached the
     * mail server.
     */
    INVALID_ARGUMENTS,

    /**
     * The mail server rejected the configured credentials. Retrying without a
     * credential change will fail again.
     */
    AUTHENTICATION_FAILED,

    /**
     * Network or TLS failure reaching the mail server. The caller may retry.
     */
    CONNECTION_FAILED,

    /**
     * Tool execution failed during runtime (folder missing, search or send
     * failure, timeouts, etc.).
     */
    EXECUTION_FAILED
}
