package me.golemcore.gateway.domain.model.hook;

public enum HookHandlerType {
    COMMAND, PROMPT
}
