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

import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Approximate token counter used for every budget decision.
 *
 * <p>
 * A message costs {@code ceil(chars / charsPerToken) + overhead}, where
 * {@code chars} is the summed length of its segments and {@code overhead}
 * covers role and framing tokens. This is a byte-length approximation, not a
 * tokenizer; it overestimates slightly for English prose.
 */
@Component
public class SizeEstimator {

    private final double charsPerToken;
    private final int messageOverhead;

    @Autowired
    public SizeEstimator(GatewayProperties properties) {
        this(properties.getCompaction().getCharsPerToken(), properties.getCompaction().getMessageOverheadTokens());
    }

    public SizeEstimator(double charsPerToken, int messageOverhead) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        this.charsPerToken = charsPerToken;
        this.messageOverhead = messageOverhead;
    }

    public int estimate(Message message) {
        long chars = 0;
        for (ContentSegment segment : message.getContent()) {
            chars += segment.textLength();
        }
        return (int) Math.ceil(chars / charsPerToken) + messageOverhead;
    }

    public int estimate(Collection<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }

    public int estimateText(String text) {
        return text == null ? 0 : (int) Math.ceil(text.length() / charsPerToken);
    }
}
