package me.golemcore.gateway.domain.model.hook;

/**
 * @param trigger
 *            {@code auto} when the budget threshold fired, {@code manual}
 *            otherwise
 */
public record PreCompactPayload(String trigger, int budgetUsed, int threshold, int turnCount)
        implements HookPayload {
}
