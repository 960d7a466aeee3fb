package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 没有已加载的插件对该设备负责
 */
@Getter
public class NoDeviceOwnerException extends HubException {

    private final String deviceId;

    public NoDeviceOwnerException(String deviceId) {
        super("No loaded plugin owns device: " + deviceId);
        this.deviceId = deviceId;
    }
}
