package me.golemcore.gateway.domain.model;

import lombok.Getter;

/**
 * A memory write exceeded its size bound and was rejected. The stored value is
 * unchanged.
 */
@Getter
public class MemoryCapacityException extends GatewayException {

    private final String blockName;
    private final int size;
    private final int limit;

    public MemoryCapacityException(String blockName, int size, int limit) {
        super("Core memory block '" + blockName + "' is " + size + " characters, limit is " + limit);
        this.blockName = blockName;
        this.size = size;
        this.limit = limit;
    }
}
