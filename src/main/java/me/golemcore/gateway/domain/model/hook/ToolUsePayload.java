package me.golemcore.gateway.domain.model.hook;

import java.util.Map;
import java.util.Objects;

/**
 * Payload of {@code pre_tool_use} and {@code permission_request}.
 */
public record ToolUsePayload(String toolName, Map<String, Object> toolInput, String toolUseId)
        implements HookPayload {

    public ToolUsePayload {
        Objects.requireNonNull(toolName, "toolName");
        toolInput = toolInput == null ? Map.of() : toolInput;
    }

    @Override
    public String matchTarget() {
        return toolName;
    }
}
