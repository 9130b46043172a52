package me.golemcore.gateway.domain.system;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structure of a compaction summary: exactly nine sections, always in this
 * order.
 *
 * <p>
 * Models do not follow formatting instructions reliably, so
 * {@link #normalize(String)} accepts markdown headings, numbered lines and
 * bold labels, and rewrites whatever it recognizes into the canonical layout.
 * Sections the model left out are emitted with {@value #EMPTY_SECTION}.
 */
public final class CompactionSummaryFormat {

    public static final List<String> SECTIONS = List.of(
            "Primary Request and Intent",
            "Key Technical Concepts",
            "Files and Code Sections",
            "Errors and Fixes",
            "Problem Solving",
            "Verbatim User Messages",
            "Pending Tasks",
            "Current Work",
            "Optional Next Step");

    public static final String EMPTY_SECTION = "None.";

    // "## 1. Name", "1. Name:", "**Name**", "### Name" and combinations
    private static final Pattern HEADING = Pattern.compile(
            "^\\s*(?:#{1,6}\\s*)?(?:\\d+[.)]\\s*)?(?:\\*\\*)?\\s*([A-Za-z][A-Za-z ]+?)\\s*(?:\\*\\*)?\\s*:?\\s*(?:\\*\\*)?\\s*$");

    private CompactionSummaryFormat() {
    }

    /**
     * Instructions for the summarizing model.
     */
    public static String instructions() {
        StringBuilder sb = new StringBuilder();
        sb.append("Summarize the conversation so far so that work can continue without it. ")
                .append("Write exactly these sections, in this order, each under a level-2 markdown heading:\n\n");
        for (int i = 0; i < SECTIONS.size(); i++) {
            sb.append("## ").append(i + 1).append(". ").append(SECTIONS.get(i)).append('\n');
        }
        sb.append("\nUnder \"Verbatim User Messages\" quote every user message word for word. ")
                .append("Name exact file paths, identifiers and error messages. ")
                .append("Write \"").append(EMPTY_SECTION).append("\" under a section with nothing to report. ")
                .append("Output only the summary.");
        return sb.toString();
    }

    /**
     * Rewrites a model answer into the canonical nine-section layout.
     *
     * @return the normalized summary, empty when no section heading was
     *         recognized
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Map<String, StringBuilder> bodies = new LinkedHashMap<>();
        String current = null;
        for (String line : raw.split("\\R")) {
            String section = sectionOf(line);
            if (section != null) {
                current = section;
                bodies.computeIfAbsent(section, k -> new StringBuilder());
                continue;
            }
            if (current != null) {
                bodies.get(current).append(line).append('\n');
            }
        }
        if (bodies.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder out = new StringBuilder();
        for (int i = 0; i < SECTIONS.size(); i++) {
            String name = SECTIONS.get(i);
            StringBuilder body = bodies.get(name);
            String text = body != null ? body.toString().strip() : "";
            if (i > 0) {
                out.append("\n\n");
            }
            out.append("## ").append(i + 1).append(". ").append(name).append('\n')
                    .append(text.isEmpty() ? EMPTY_SECTION : text);
        }
        return Optional.of(out.toString());
    }

    static String sectionOf(String line) {
        Matcher matcher = HEADING.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String candidate = matcher.group(1).trim().toLowerCase(Locale.ROOT);
        for (String section : SECTIONS) {
            if (section.toLowerCase(Locale.ROOT).equals(candidate)) {
                return section;
            }
        }
        return null;
    }
}
