package com.hubframe.core.device;

import com.hubframe.api.model.LinkDirection;
import com.hubframe.api.model.LinkType;

/**
 * 设备关联边
 *
 * @param sequence 插入序号，遍历时决定同层顺序
 */
public record DeviceLink(String from, String to, LinkType linkType, LinkDirection direction, long sequence) {

    public boolean isBidirectional() {
        return direction == LinkDirection.BIDIRECTIONAL;
    }

    /**
     * 从给定端点出发能否沿此边到达另一端
     */
    boolean traversableFrom(String deviceId) {
        return from.equals(deviceId) || (isBidirectional() && to.equals(deviceId));
    }

    String otherEnd(String deviceId) {
        return from.equals(deviceId) ? to : from;
    }

    /**
     * 是否连接同一对设备（双向边忽略方向）
     */
    boolean connects(String a, String b) {
        return (from.equals(a) && to.equals(b)) || (isBidirectional() && from.equals(b) && to.equals(a));
    }
}
