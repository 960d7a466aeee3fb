package com.hubframe.core.spi;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.model.RuntimeMode;

import java.time.Duration;
import java.util.Map;

/**
 * 插件容器 SPI
 * 定义一种运行模式下插件运行环境的最小契约
 */
public interface PluginContainer {

    RuntimeMode mode();

    /**
     * 启动容器，必须在期限内完成；失败时容器自行清理已启动的部分
     *
     * @param context  插件上下文 (Core 传给插件的令牌)
     * @param deadline 加载期限
     */
    void start(PluginContext context, Duration deadline) throws Exception;

    /**
     * 停止容器，超过期限则强制结束
     */
    void stop(Duration deadline);

    /**
     * 容器是否存活
     */
    boolean isActive();

    /**
     * 健康检查，返回 false 或抛出异常都记为一次失败
     */
    boolean checkHealth() throws Exception;

    /**
     * 执行插件动作
     */
    Object invoke(String action, Map<String, Object> params) throws Exception;
}
