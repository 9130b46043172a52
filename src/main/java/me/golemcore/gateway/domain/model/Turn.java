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
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One logical exchange: the messages produced in response to a single
 * triggering event. A {@link TurnKind#COMPACTION_SUMMARY} turn stands in for a
 * compacted prefix of history.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Turn {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    @Builder.Default
    TurnKind kind = TurnKind.VERBATIM;

    @Singular
    List<Message> messages;

    /** Estimated size in budget units (approximate tokens). */
    int estimatedSize;

    Instant createdAt;

    @JsonIgnore
    public boolean isSummary() {
        return kind == TurnKind.COMPACTION_SUMMARY;
    }
}
