package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Conversation role of a canonical {@link Message}.
 */
public enum Role {
    USER, ASSISTANT, SYSTEM, TOOL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role is required");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
        case "user" -> USER;
        case "assistant", "model" -> ASSISTANT;
        case "system", "developer" -> SYSTEM;
        case "tool", "function" -> TOOL;
        default -> throw new IllegalArgumentException("Unknown role: " + value);
        };
    }
}
