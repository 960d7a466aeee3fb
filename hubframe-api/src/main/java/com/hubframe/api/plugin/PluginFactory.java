package com.hubframe.api.plugin;

/**
 * 插件工厂
 * <p>
 * 进程内插件的注册入口：原生运行时通过 {@link java.util.ServiceLoader} 发现，
 * Spring Boot Starter 收集容器中的 Bean。每次加载都会调用 {@link #create()} 取得新实例。
 *
 * @author HubFrame
 */
public interface PluginFactory {

    /**
     * 插件ID，需与 plugin.yml 中的 id 一致
     */
    String pluginId();

    HubPlugin create();
}
