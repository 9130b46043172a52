package me.golemcore.gateway.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-independent response. {@code incomplete} marks a streamed response
 * whose terminal event never arrived; its message still carries every piece
 * received before the stream ended.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalResponse {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_LENGTH = "length";
    public static final String FINISH_TOOL_CALLS = "tool_calls";
    public static final String FINISH_CONTENT_FILTER = "content_filter";
    public static final String FINISH_INCOMPLETE = "incomplete";

    private String id;
    private String model;
    private String providerId;
    private Message message;
    private String finishReason;
    private TokenUsage usage;
    private boolean incomplete;

    @Builder.Default
    private List<String> notes = new ArrayList<>();

    /**
     * True when a requested feature was dropped for this provider; {@link #notes}
     * says which.
     */
    @JsonIgnore
    public boolean isDegraded() {
        return notes != null && !notes.isEmpty();
    }
}
