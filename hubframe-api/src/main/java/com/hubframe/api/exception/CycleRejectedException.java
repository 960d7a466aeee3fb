package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 新增关联会在深度上限内形成环
 */
@Getter
public class CycleRejectedException extends HubException {

    private final String fromDevice;
    private final String toDevice;

    public CycleRejectedException(String fromDevice, String toDevice, int maxDepth) {
        super("Link " + fromDevice + " -> " + toDevice + " would create a cycle within depth " + maxDepth);
        this.fromDevice = fromDevice;
        this.toDevice = toDevice;
    }
}
