package com.hubframe.core.device;

import java.util.List;

/**
 * 关联设备及到达它的路径
 *
 * @param path 从起点出发依次经过的边，长度即跳数
 */
public record RelatedDevice(String deviceId, List<DeviceLink> path) {

    public RelatedDevice {
        path = List.copyOf(path);
    }

    public int depth() {
        return path.size();
    }
}
