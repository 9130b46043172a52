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

import java.util.regex.Pattern;

/**
 * Path glob support for guardrails.
 *
 * <p>
 * {@code **}{@code /} matches zero or more directories, a trailing
 * {@code **} matches anything, {@code *} matches within one path segment and
 * {@code ?} matches one character other than {@code /}. Patterns are
 * anchored at both ends.
 */
public final class GlobMatcher {

    private static final String REGEX_SPECIALS = ".()[]{}+^$|\\";

    private GlobMatcher() {
    }

    public static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                if (doubleStar && i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                    regex.append("(.*/)?");
                    i += 3;
                } else if (doubleStar) {
                    regex.append(".*");
                    i += 2;
                } else {
                    regex.append("[^/]*");
                    i++;
                }
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else {
                if (REGEX_SPECIALS.indexOf(c) >= 0) {
                    regex.append('\\');
                }
                regex.append(c);
                i++;
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }

    /**
     * Forward slashes only, without a leading {@code ./}.
     */
    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}
