package com.hubframe.api.context;

import com.hubframe.api.auth.TokenService;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.api.event.EventHandler;
import com.hubframe.api.model.RuntimeMode;

import java.util.Map;
import java.util.Optional;

/**
 * 插件上下文
 * 提供插件运行时的环境信息和能力获取入口
 * <p>
 * 通过上下文建立的订阅和绑定归插件所有，卸载时由宿主统一释放。
 *
 * @author HubFrame
 */
public interface PluginContext {

    /**
     * 获取当前插件的唯一标识
     */
    String getPluginId();

    /**
     * 当前运行模式
     */
    RuntimeMode getRuntimeMode();

    /**
     * 插件配置（只读快照）
     */
    Map<String, Object> getConfig();

    /**
     * 订阅事件
     *
     * @param pattern 主题模式，{@code *} 匹配恰好一个段
     * @return 订阅ID
     */
    String subscribeEvent(String pattern, EventHandler handler);

    void unsubscribeEvent(String subscriptionId);

    /**
     * 发布事件，来源自动标记为当前插件
     */
    void emitEvent(String topic, Map<String, Object> payload);

    /**
     * 声明设备绑定
     *
     * @param selector {@code key=value[,key=value]*}，值可含 {@code *} 通配
     */
    void bindDevices(String selector);

    /**
     * 插件专属命名空间下的缓存
     */
    Optional<KeyValueCache> getCache();

    /**
     * 令牌服务（沙箱模式下不可用）
     */
    Optional<TokenService> getTokenService();
}
