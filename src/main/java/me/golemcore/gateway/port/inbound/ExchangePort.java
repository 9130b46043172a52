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

import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.service.CompactionService;

/**
 * Inbound use cases of the gateway: exchanges and the lifecycle events that
 * surround them.
 */
public interface ExchangePort {

    /**
     * Runs a non-streaming exchange.
     *
     * @throws me.golemcore.gateway.domain.model.UpstreamException
     *             if the provider call fails
     * @throws IllegalStateException
     *             if the session has ended
     */
    ExchangeOutcome exchange(ExchangeCommand command);

    /**
     * Prepares a streaming exchange and returns an
     * {@link ExchangeOutcome.Streaming} whose work starts on subscription.
     *
     * @throws IllegalArgumentException
     *             if there are no incoming messages
     * @throws IllegalStateException
     *             if the session has ended
     */
    ExchangeOutcome exchangeStream(ExchangeCommand command);

    /**
     * Compacts the session now, regardless of its budget.
     *
     * @throws IllegalArgumentException
     *             if the session does not exist
     */
    CompactionService.Result compact(String sessionId);

    HookResolution sessionStart(String sessionId, String source);

    /**
     * Fires {@code session_end} hooks, ends the session, stores its
     * recent-session summary and drops its guardrail diff.
     */
    Session sessionEnd(String sessionId, String reason);

    /**
     * Markdown handoff of the session for the one that continues its work.
     *
     * @throws IllegalArgumentException
     *             if the session does not exist
     */
    String handoff(String sessionId);

    HookResolution notify(String sessionId, String message, String notificationType);

    HookResolution subagentStart(String sessionId, String agentId, String agentType);

    HookResolution subagentStop(String sessionId, String agentId, String agentType, String failureReason);
}
