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

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of operations offered to the agent, keyed by tool name.
 */
public enum EmailOperation {

    READ("read_emails"),
    FILTER("filter_emails"),
    SEND("send_email"),
    UNREAD_COUNT("get_unread_count");

    private final String toolName;

    EmailOperation(String toolName) {
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    public static Optional<EmailOperation> fromToolName(String toolName) {
        return Arrays.stream(values())
                .filter(operation -> operation.toolName.equals(toolName))
                .findFirst();
    }
}
