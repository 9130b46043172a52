package me.golemcore.gateway.domain.model.hook;

/**
 * Payload of {@code subagent_start} and {@code subagent_stop}.
 */
public record SubagentPayload(String agentId, String agentType, String failureReason) implements HookPayload {

    @Override
    public String matchTarget() {
        return agentType;
    }
}
