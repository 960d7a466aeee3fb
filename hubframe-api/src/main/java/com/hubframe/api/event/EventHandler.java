package com.hubframe.api.event;

/**
 * 事件处理器
 * <p>
 * 抛出的异常会被总线捕获并记录，不会影响其他订阅者。
 *
 * @author HubFrame
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(Event event) throws Exception;
}
