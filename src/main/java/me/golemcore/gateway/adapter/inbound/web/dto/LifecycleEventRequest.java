package me.golemcore.gateway.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lifecycle event reported by a client. {@code type} is one of
 * {@code session_start}, {@code notification}, {@code subagent_start} or
 * {@code subagent_stop}; the other fields apply to the matching type only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEventRequest {
    private String type;
    private String source;
    private String message;
    private String notificationType;
    private String agentId;
    private String agentType;
    private String failureReason;
}
