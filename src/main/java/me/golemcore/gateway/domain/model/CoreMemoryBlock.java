package me.golemcore.gateway.domain.model;

import java.time.Instant;

/**
 * Named always-injected memory block. Exactly one current value per name.
 */
public record CoreMemoryBlock(String name, String content, Instant updatedAt) {
}
