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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces an HTML body to readable plain text for the preview of messages
 * that carry no {@code text/plain} part.
 */
public final class HtmlSanitizer {

    private static final Pattern INVISIBLE_BLOCKS = Pattern.compile(
            "<(script|style|head)[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BLOCK_TAGS = Pattern.compile("<(br|p|div|tr|li|h[1-6])[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]+);");
    private static final Pattern MULTI_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern MULTI_SPACES = Pattern.compile("[ \t]{2,}");

    private HtmlSanitizer() {
    }

    /**
     * Strips tags, drops script/style content and decodes common entities.
     *
     * @param html
     *            the HTML content, may be null
     * @return plain text, never null
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }

        String result = INVISIBLE_BLOCKS.matcher(html).replaceAll("");
        result = BLOCK_TAGS.matcher(result).replaceAll("\n");
        result = ALL_TAGS.matcher(result).replaceAll("");
        result = decodeEntities(result);
        result = MULTI_NEWLINES.matcher(result).replaceAll("\n\n");
        result = MULTI_SPACES.matcher(result).replaceAll(" ");

        return result.strip();
    }

    private static String decodeEntities(String text) {
        Matcher matcher = NUMERIC_ENTITY.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int radix = matcher.group(1).isEmpty() ? 10 : 16;
            String replacement;
            try {
                replacement = new String(Character.toChars(Integer.parseInt(matcher.group(2), radix)));
            } catch (IllegalArgumentException e) { // NumberFormatException included
                replacement = matcher.group();
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);

        return sb.toString()
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
