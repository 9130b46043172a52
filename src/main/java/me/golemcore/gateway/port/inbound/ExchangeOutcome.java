package me.golemcore.gateway.port.inbound;

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

import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.StreamDelta;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Result of an exchange.
 */
public interface ExchangeOutcome {

    String sessionId();

    /**
     * The response was received, reviewed and appended to the session.
     *
     * @param skippedSources
     *            context sources that contributed nothing
     */
    record Completed(String sessionId, CanonicalResponse response, List<String> skippedSources)
            implements ExchangeOutcome {
    }

    /**
     * A {@code user_prompt_submit} hook refused the prompt of a non-streaming
     * exchange. Nothing was sent upstream and nothing was appended.
     */
    record Blocked(String sessionId, String reason) implements ExchangeOutcome {
    }

    /**
     * A streaming exchange. Subscribing to {@code deltas} takes the session
     * lock, which is held until the stream terminates or is cancelled; the
     * turn is appended only when it completes. A refused prompt arrives as a
     * single {@link StreamDelta.Kind#BLOCKED} delta.
     */
    record Streaming(String sessionId, Flux<StreamDelta> deltas) implements ExchangeOutcome {
    }
}
