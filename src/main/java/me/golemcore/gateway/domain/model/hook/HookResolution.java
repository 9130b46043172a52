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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Merged result of all handlers matched to one event.
 */
@Value
@Builder
public class HookResolution {

    HookEventKind kind;
    boolean blocked;
    String blockReason;
    HookPermission permission;
    Map<String, Object> updatedInput;
    String updatedPrompt;

    @Singular
    List<String> systemMessages;

    @Singular
    List<HookOutcome> outcomes;

    public static HookResolution empty(HookEventKind kind) {
        return HookResolution.builder().kind(kind).build();
    }

    public boolean hasUpdatedInput() {
        return updatedInput != null;
    }
}
