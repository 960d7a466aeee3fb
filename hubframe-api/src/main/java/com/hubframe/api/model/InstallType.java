package com.hubframe.api.model;

import java.util.Locale;

/**
 * 安装来源类型
 *
 * @author HubFrame
 */
public enum InstallType {

    /**
     * HTTP 下载的插件包
     */
    URL("url"),

    /**
     * 源码仓库（git clone）
     */
    GIT("git"),

    /**
     * 本地目录
     */
    LOCAL("local");

    private final String wireName;

    InstallType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static InstallType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (InstallType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown install type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
