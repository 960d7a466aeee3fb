package com.hubframe.api.model;

import com.hubframe.api.exception.InvalidLinkTypeException;

import java.util.Locale;

/**
 * 设备关联类型
 */
public enum LinkType {

    BRIDGE("bridge"),
    PROXY("proxy"),
    SYNC("sync"),
    MIRROR("mirror");

    private final String wireName;

    LinkType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws InvalidLinkTypeException 未知类型
     */
    public static LinkType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (LinkType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidLinkTypeException(value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
