package me.golemcore.gateway.domain.system;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a hook entry applies to an event.
 *
 * <p>
 * A missing, blank or {@code *} matcher applies to everything. Otherwise the
 * matcher is a regular expression searched for in the event's match target.
 * An invalid expression never matches.
 */
@Component
@Slf4j
public class HookMatcher {

    private static final String MATCH_ALL = "*";

    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    public boolean matches(String matcher, String target) {
        if (matcher == null || matcher.isBlank() || MATCH_ALL.equals(matcher.trim())) {
            return true;
        }
        Optional<Pattern> pattern = patterns.computeIfAbsent(matcher, this::compile);
        return pattern.isPresent() && target != null && pattern.get().matcher(target).find();
    }

    private Optional<Pattern> compile(String matcher) {
        try {
            return Optional.of(Pattern.compile(matcher));
        } catch (PatternSyntaxException e) {
            log.warn("[Hooks] Invalid matcher '{}', entry disabled: {}", matcher, e.getDescription());
            return Optional.empty();
        }
    }
}
