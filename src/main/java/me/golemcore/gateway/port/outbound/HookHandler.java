package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.hook.HookDecision;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookExecutionException;

import java.time.Duration;

/**
 * Externally defined procedure run at a lifecycle event. Input is the event,
 * output is one structured decision, lifetime is bounded by {@link #timeout()}.
 *
 * <p>
 * Handlers matched to the same event run concurrently and must not assume
 * anything about each other.
 */
public interface HookHandler {

    String name();

    Duration timeout();

    /**
     * Runs the handler. A blocking failure is returned as a blocking
     * {@link HookDecision}; non-blocking failures are thrown.
     *
     * @throws InterruptedException
     *             when the dispatch abandoned this handler
     */
    HookDecision execute(HookEvent event) throws HookExecutionException, InterruptedException;
}
