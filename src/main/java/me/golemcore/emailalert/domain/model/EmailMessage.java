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

import lombok.Builder;
import lombok.Value;

/**
 * Normalized email as returned by the read and filter operations.
 *
 * <p>
 * Built once per fetch from the raw IMAP message and never mutated. The
 * {@code id} is the IMAP sequence number of the message inside the session
 * that fetched it, so it must not be stored or reused across calls.
 * {@code unread} is a snapshot of the {@code \Seen} flag at fetch time.
 */
@Value
@Builder
public class EmailMessage {

    String id;
    @Builder.Default
    String subject = "";
    @Builder.Default
    String from = "";
    @Builder.Default
    String to = "";
    @Builder.Default
    String date = "";
    @Builder.Default
    String body = "";
    boolean unread;
}
