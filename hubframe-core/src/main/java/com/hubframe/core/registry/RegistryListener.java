package com.hubframe.core.registry;

/**
 * 注册表变更监听器
 * 在变更提交后、调用线程上通知。
 */
public interface RegistryListener {

    default void onRegistered(PluginRecord record) {
    }

    default void onUpdated(PluginRecord previous, PluginRecord current) {
    }

    default void onEnabledChanged(PluginRecord record) {
    }

    default void onRemoved(PluginRecord record) {
    }
}
