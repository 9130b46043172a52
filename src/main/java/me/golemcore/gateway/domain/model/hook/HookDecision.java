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
import lombok.Value;

import java.util.Map;

/**
 * Structured result of one handler run.
 */
@Value
@Builder
public class HookDecision {

    @Builder.Default
    boolean continueProcessing = true;

    boolean suppressOutput;
    String systemMessage;
    HookPermission permission;
    Map<String, Object> updatedInput;
    String updatedPrompt;
    String reason;

    public static HookDecision proceed() {
        return HookDecision.builder().build();
    }

    public static HookDecision block(String reason) {
        return HookDecision.builder().continueProcessing(false).reason(reason).build();
    }

    /**
     * A decision blocks when it stops processing or denies permission.
     */
    public boolean isBlocking() {
        return !continueProcessing || permission == HookPermission.DENY;
    }
}
