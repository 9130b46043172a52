package me.golemcore.gateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Requested reasoning/thinking behavior. Each adapter maps this onto its own
 * parameter shape: a token budget, a discrete effort level, or an enable flag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThinkingRequest {

    private boolean enabled;
    private Integer budgetTokens;
    private String effort; // low | medium | high
    private boolean preserveAcrossTurns;

    public static ThinkingRequest enabled() {
        return ThinkingRequest.builder().enabled(true).build();
    }
}
