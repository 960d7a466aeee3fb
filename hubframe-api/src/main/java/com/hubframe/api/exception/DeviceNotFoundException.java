package com.hubframe.api.exception;

import lombok.Getter;

@Getter
public class DeviceNotFoundException extends HubException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device not found: " + deviceId);
        this.deviceId = deviceId;
    }
}
