package me.golemcore.gateway.domain.model.hook;

import java.util.Map;
import java.util.Objects;

public record PostToolUsePayload(String toolName, Map<String, Object> toolInput, String toolUseId,
        String toolResponse) implements HookPayload {

    public PostToolUsePayload {
        Objects.requireNonNull(toolName, "toolName");
        toolInput = toolInput == null ? Map.of() : toolInput;
    }

    @Override
    public String matchTarget() {
        return toolName;
    }
}
