package me.golemcore.gateway.domain.model.hook;

import java.util.Locale;
import java.util.Optional;

/**
 * Permission verdict for a tool call. Ordinal order is restrictiveness order:
 * when handlers disagree the most restrictive verdict wins.
 */
public enum HookPermission {
    ALLOW, ASK, DENY;

    public static Optional<HookPermission> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "allow", "approve" -> Optional.of(ALLOW);
        case "deny", "block" -> Optional.of(DENY);
        case "ask" -> Optional.of(ASK);
        default -> Optional.empty();
        };
    }

    public HookPermission mostRestrictive(HookPermission other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
