package me.golemcore.gateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Assistant request to invoke a tool. The {@code id} is the provider-issued
 * call identifier and must survive every translation unchanged.
 */
public record ToolCallSegment(String id, String name, Map<String, Object> arguments) implements ContentSegment {

    public ToolCallSegment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public ToolCallSegment withArguments(Map<String, Object> newArguments) {
        return new ToolCallSegment(id, name, newArguments);
    }

    @Override
    public int textLength() {
        return name.length() + String.valueOf(arguments).length();
    }
}
