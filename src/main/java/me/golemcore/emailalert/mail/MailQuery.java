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

import jakarta.mail.search.SearchTerm;

/**
 * One composite IMAP search, produced by {@link MailQueryTranslator}.
 *
 * <p>
 * Holds the Jakarta Mail {@link SearchTerm} that is sent to the server and the
 * equivalent IMAP {@code SEARCH} expression (e.g. {@code UNSEEN FROM "a@x.com"})
 * used for logging and tests. A match-all query has no search term and the
 * expression {@code ALL}.
 */
public final class MailQuery {

    static final String MATCH_ALL = "ALL";

    private static final MailQuery ALL = new MailQuery(null, MATCH_ALL);

    private final SearchTerm searchTerm;
    private final String expression;

    MailQuery(SearchTerm searchTerm, String expression) {
        this.searchTerm = searchTerm;
        this.expression = expression;
    }

    public static MailQuery matchAll() {
        return ALL;
    }

    public boolean isMatchAll() {
        return searchTerm == null;
    }

    /**
     * Returns the search term, or {@code null} for a match-all query.
     */
    public SearchTerm getSearchTerm() {
        return searchTerm;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
