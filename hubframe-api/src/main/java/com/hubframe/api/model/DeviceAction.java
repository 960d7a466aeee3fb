package com.hubframe.api.model;

import java.util.Locale;

/**
 * 设备控制动作
 */
public enum DeviceAction {

    ON("on"),
    OFF("off"),
    TOGGLE("toggle"),
    SET("set"),
    EXECUTE("execute");

    private final String wireName;

    DeviceAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static DeviceAction fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DeviceAction action : values()) {
                if (action.wireName.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown device action: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
