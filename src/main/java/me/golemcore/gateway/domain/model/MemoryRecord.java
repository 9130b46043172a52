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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Archival memory record. Records are versioned: an update stores a new row
 * pointing at its predecessor through {@code supersedes}, and the predecessor
 * gets {@code supersededBy} set. Rows are never rewritten in place.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

    private long id;
    private String text;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private int version;
    private Long supersedes;
    private Long supersededBy;
    private Instant createdAt;

    /** Relevance score from the last search; lower is better (bm25). */
    private Double score;

    public boolean isCurrent() {
        return supersededBy == null;
    }
}
