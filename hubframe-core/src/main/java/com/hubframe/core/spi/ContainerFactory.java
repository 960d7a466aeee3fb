package com.hubframe.core.spi;

import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.registry.PluginRecord;

/**
 * 容器工厂 SPI
 */
public interface ContainerFactory {

    /**
     * 创建容器实例
     *
     * @param record 插件记录（配置中携带各模式所需参数）
     * @param mode   目标运行模式
     * @return 尚未启动的容器
     */
    PluginContainer create(PluginRecord record, RuntimeMode mode);
}
