package me.golemcore.gateway.domain.model.hook;

import java.util.Map;
import java.util.Objects;

public record ToolFailurePayload(String toolName, Map<String, Object> toolInput, String toolUseId, String error)
        implements HookPayload {

    public ToolFailurePayload {
        Objects.requireNonNull(toolName, "toolName");
        toolInput = toolInput == null ? Map.of() : toolInput;
    }

    @Override
    public String matchTarget() {
        return toolName;
    }
}
