package me.golemcore.gateway.domain.model.hook;

public record SessionEndPayload(String reason) implements HookPayload {
}
