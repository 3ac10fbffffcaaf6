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

package me.golemcore.emailalert.mail;

import jakarta.mail.Flags;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.SearchTerm;
import jakarta.mail.search.SubjectTerm;
import me.golemcore.emailalert.domain.model.FilterCriteria;
import me.golemcore.emailalert.domain.model.ReadStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates {@link FilterCriteria} into a single IMAP search.
 *
 * <p>
 * Sender and subject become {@code FROM} / {@code SUBJECT} predicates, which
 * IMAP servers match as case-insensitive substrings; the read status becomes
 * {@code UNSEEN} / {@code SEEN}. All predicates are joined into one
 * conjunctive query so the server does the filtering in one round trip. The
 * folder is not part of the query: it is selected when the session opens.
 */
@Component
public class MailQueryTranslator {

    private static final int SINGLE_TERM = 1;

    public MailQuery translate(FilterCriteria criteria) {
        List<SearchTerm> terms = new ArrayList<>();
        List<String> tokens = new ArrayList<>();

        ReadStatus readStatus = criteria.getReadStatus() != null ? criteria.getReadStatus() : ReadStatus.ANY;
        if (readStatus == ReadStatus.UNREAD) {
            terms.add(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
            tokens.add("UNSEEN");
        } else if (readStatus == ReadStatus.READ) {
            terms.add(new FlagTerm(new Flags(Flags.Flag.SEEN), true));
            tokens.add("SEEN");
        }

        if (criteria.hasSender()) {
            String sender = criteria.getSender().trim();
            terms.add(new FromStringTerm(sender));
            tokens.add("FROM " + quote(sender));
        }

        if (criteria.hasSubject()) {
            String subject = criteria.getSubject().trim();
            terms.add(new SubjectTerm(subject));
            tokens.add("SUBJECT " + quote(subject));
        }

        if (terms.isEmpty()) {
            return MailQuery.matchAll();
        }

        SearchTerm searchTerm = terms.size() == SINGLE_TERM
                ? terms.get(0)
                : new AndTerm(terms.toArray(new SearchTerm[0]));
        return new MailQuery(searchTerm, String.join(" ", tokens));
    }

    /**
     * Query matching every message without {@code \Seen}.
     */
    public MailQuery unreadOnly() {
        return translate(FilterCriteria.builder().readStatus(ReadStatus.UNREAD).build());
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
