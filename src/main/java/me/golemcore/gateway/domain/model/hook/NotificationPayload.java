package me.golemcore.gateway.domain.model.hook;

public record NotificationPayload(String message, String notificationType) implements HookPayload {

    @Override
    public String matchTarget() {
        return notificationType;
    }
}
