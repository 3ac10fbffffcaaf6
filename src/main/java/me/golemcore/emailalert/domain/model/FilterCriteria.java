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
 * Search request for the filter operation. Every field that is set narrows the
 * result (logical AND); blank strings and {@link ReadStatus#ANY} impose no
 * constraint. A {@code null} folder means the configured default folder and a
 * {@code null} limit means all matches.
 */
@Value
@Builder
public class FilterCriteria {

    String sender;
    String subject;
    @Builder.Default
    ReadStatus readStatus = ReadStatus.ANY;
    String folder;
    Integer limit;

    public boolean hasSender() {
        return sender != null && !sender.isBlank();
    }

    public boolean hasSubject() {
        return subject != null && !subject.isBlank();
    }

    public static FilterCriteria none() {
        return FilterCriteria.builder().build();
    }
}
