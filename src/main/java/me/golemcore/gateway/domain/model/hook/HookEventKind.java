package me.golemcore.gateway.domain.model.hook;

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

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed set of lifecycle points at which hooks run.
 */
public enum HookEventKind {

    SESSION_START("session_start", "SessionStart", SessionStartPayload.class),
    SESSION_END("session_end", "SessionEnd", SessionEndPayload.class),
    USER_PROMPT_SUBMIT("user_prompt_submit", "UserPromptSubmit", UserPromptSubmitPayload.class),
    PRE_TOOL_USE("pre_tool_use", "PreToolUse", ToolUsePayload.class),
    POST_TOOL_USE("post_tool_use", "PostToolUse", PostToolUsePayload.class),
    POST_TOOL_USE_FAILURE("post_tool_use_failure", "PostToolUseFailure", ToolFailurePayload.class),
    STOP("stop", "Stop", StopPayload.class),
    SUBAGENT_START("subagent_start", "SubagentStart", SubagentPayload.class),
    SUBAGENT_STOP("subagent_stop", "SubagentStop", SubagentPayload.class),
    PRE_COMPACT("pre_compact", "PreCompact", PreCompactPayload.class),
    PERMISSION_REQUEST("permission_request", "PermissionRequest", ToolUsePayload.class),
    NOTIFICATION("notification", "Notification", NotificationPayload.class);

    private final String key;
    private final String settingsName;
    private final Class<? extends HookPayload> payloadType;

    HookEventKind(String key, String settingsName, Class<? extends HookPayload> payloadType) {
        this.key = key;
        this.settingsName = settingsName;
        this.payloadType = payloadType;
    }

    public String key() {
        return key;
    }

    /**
     * Event name as written in Claude-style {@code settings.json} files.
     */
    public String settingsName() {
        return settingsName;
    }

    public Class<? extends HookPayload> payloadType() {
        return payloadType;
    }

    public static Optional<HookEventKind> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }

    public static Optional<HookEventKind> fromSettingsName(String name) {
        return Arrays.stream(values()).filter(k -> k.settingsName.equals(name)).findFirst();
    }
}
