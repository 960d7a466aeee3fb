package com.hubframe.api.plugin;

import com.hubframe.api.context.PluginContext;

import java.util.Map;

/**
 * 插件契约
 * 进程内、嵌入式插件直接实现此接口；微服务插件由宿主侧代理实现同样的契约。
 *
 * @author HubFrame
 */
public interface HubPlugin {

    /**
     * 插件加载时调用
     * 插件应在这里订阅事件、声明设备绑定
     *
     * @param context 插件上下文
     */
    default void onLoad(PluginContext context) throws Exception {
        // Default empty implementation
    }

    /**
     * 插件卸载时调用
     * 订阅和绑定由宿主统一回收，这里只需释放插件自身资源
     *
     * @param context 插件上下文
     */
    default void onUnload(PluginContext context) throws Exception {
        // Default empty implementation
    }

    /**
     * 执行动作
     *
     * @param action 动作名，如 {@code on} / {@code off} / {@code set}
     * @param params 动作参数
     * @return 执行结果，可为空
     */
    default Object invoke(String action, Map<String, Object> params) throws Exception {
        throw new UnsupportedOperationException("Action not supported: " + action);
    }

    /**
     * 健康检查
     */
    default boolean healthCheck() throws Exception {
        return true;
    }
}
