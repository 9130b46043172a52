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

import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.Turn;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the markdown handoff a following session starts from.
 *
 * <p>
 * Sections without content are left out. Requests are the first line of each
 * user message in the verbatim history, so turns folded into a compaction
 * summary no longer show up.
 */
public final class SessionHandoff {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'")
            .withZone(ZoneOffset.UTC);
    private static final int MAX_REQUEST_CHARS = 100;

    private SessionHandoff() {
    }

    public static String render(Session session, List<String> filesModified, List<String> issuesWorked) {
        StringBuilder sb = new StringBuilder("## Session Handoff\n\n");
        sb.append("Previous Session: ").append(session.getId()).append('\n');
        sb.append("Status: ").append(session.getStatus()).append('\n');
        sb.append("Duration: ").append(format(session.getCreatedAt())).append(" to ")
                .append(format(session.getUpdatedAt())).append('\n');
        if (session.getCompactionCount() > 0) {
            sb.append("Compactions: ").append(session.getCompactionCount()).append('\n');
        }
        sb.append('\n');

        section(sb, "Requests", requests(session));
        section(sb, "Issues Worked", issuesWorked);
        section(sb, "Files Modified", filesModified);

        if (session.getHandoffNotes() != null && !session.getHandoffNotes().isBlank()) {
            sb.append("### Notes for Next Session\n").append(session.getHandoffNotes()).append("\n\n");
        }

        TokenUsage usage = session.getUsage();
        if (usage != null && usage.getTotalTokens() > 0) {
            sb.append("### Token Usage\n");
            sb.append("- Input: ").append(usage.getInputTokens()).append(" tokens\n");
            sb.append("- Output: ").append(usage.getOutputTokens()).append(" tokens\n");
            sb.append("- Turns: ").append(session.getVerbatimTurnCount()).append('\n');
        }
        return sb.toString();
    }

    private static List<String> requests(Session session) {
        List<String> requests = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        for (Turn turn : session.getTurns()) {
            if (!turn.isSummary()) {
                messages.addAll(turn.getMessages());
            }
        }
        for (Message message : messages) {
            if (message.getRole() != Role.USER) {
                continue;
            }
            String firstLine = message.getText().strip().lines().findFirst().orElse("");
            if (!firstLine.isEmpty()) {
                requests.add(firstLine.length() > MAX_REQUEST_CHARS
                        ? firstLine.substring(0, MAX_REQUEST_CHARS) + "..."
                        : firstLine);
            }
        }
        return requests;
    }

    private static void section(StringBuilder sb, String title, List<String> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        sb.append("### ").append(title).append('\n');
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        sb.append('\n');
    }

    private static String format(Instant instant) {
        return instant != null ? TIMESTAMP.format(instant) : "unknown";
    }
}
