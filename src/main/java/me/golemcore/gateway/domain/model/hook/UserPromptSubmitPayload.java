package me.golemcore.gateway.domain.model.hook;

import java.util.Objects;

public record UserPromptSubmitPayload(String prompt) implements HookPayload {

    public UserPromptSubmitPayload {
        Objects.requireNonNull(prompt, "prompt");
    }

    @Override
    public String matchTarget() {
        return prompt;
    }
}
