package com.hubframe.api.model;

import com.hubframe.api.exception.InvalidDirectionException;

import java.util.Locale;

/**
 * 设备关联方向
 */
public enum LinkDirection {

    BIDIRECTIONAL("bidirectional"),
    UNIDIRECTIONAL("unidirectional");

    private final String wireName;

    LinkDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws InvalidDirectionException 未知方向
     */
    public static LinkDirection fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (LinkDirection direction : values()) {
                if (direction.wireName.equals(normalized)) {
                    return direction;
                }
            }
        }
        throw new InvalidDirectionException(value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
