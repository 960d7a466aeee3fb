package com.hubframe.core.device;

/**
 * 插件设备绑定
 *
 * @param sequence 登记顺序，归属解析时靠前者优先
 */
public record PluginBinding(String pluginId, DeviceSelector selector, long sequence) {

    public String expression() {
        return selector.expression();
    }
}
