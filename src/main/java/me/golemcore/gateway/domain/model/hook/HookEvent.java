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

import java.util.Objects;

/**
 * Lifecycle event handed to hook handlers. Read-only to handlers.
 *
 * <p>
 * The payload must be of the type declared by {@link HookEventKind#payloadType()};
 * any other combination is rejected at construction.
 */
public record HookEvent(HookEventKind kind, String sessionId, String cwd, String permissionMode,
        HookPayload payload) {

    public static final String DEFAULT_PERMISSION_MODE = "default";

    public HookEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        if (!kind.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Event " + kind.key() + " requires payload "
                    + kind.payloadType().getSimpleName() + " but got " + payload.getClass().getSimpleName());
        }
        permissionMode = permissionMode == null ? DEFAULT_PERMISSION_MODE : permissionMode;
    }

    public static HookEvent of(HookEventKind kind, String sessionId, String cwd, HookPayload payload) {
        return new HookEvent(kind, sessionId, cwd, DEFAULT_PERMISSION_MODE, payload);
    }

    /**
     * Text the entry matchers are applied to: tool name for tool events, prompt
     * for prompt submission, otherwise the event key.
     */
    public String matchTarget() {
        String target = payload.matchTarget();
        return target != null ? target : kind.key();
    }
}
