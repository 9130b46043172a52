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

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the short plain-text digest stored as a recent-session summary.
 */
public final class SessionDigest {

    private static final int MAX_REQUEST_CHARS = 100;
    private static final int MAX_ACTION_CHARS = 200;

    private SessionDigest() {
    }

    public static String of(Session session) {
        List<String> requests = new ArrayList<>();
        String lastAction = "";
        for (Message message : session.getHistoryMessages()) {
            String text = message.getText();
            if (text.isBlank()) {
                continue;
            }
            if (message.getRole() == Role.USER) {
                requests.add(truncate(text.lines().findFirst().orElse(""), MAX_REQUEST_CHARS));
            } else if (message.getRole() == Role.ASSISTANT) {
                lastAction = truncate(String.join(" ", text.lines().limit(3).toList()), MAX_ACTION_CHARS);
            }
        }
        StringBuilder sb = new StringBuilder("Session: ").append(session.getId());
        if (!requests.isEmpty()) {
            sb.append("\nUser requests: ").append(String.join("; ", requests));
        }
        if (!lastAction.isEmpty()) {
            sb.append("\nLast action: ").append(lastAction);
        }
        return sb.toString();
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
