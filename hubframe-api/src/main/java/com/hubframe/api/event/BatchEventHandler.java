package com.hubframe.api.event;

import java.util.List;

/**
 * 批量事件处理器
 * 总线在每个投递周期把至多一批事件（按发布顺序）整体交给处理器。
 */
public interface BatchEventHandler extends EventHandler {

    void onBatch(List<Event> events) throws Exception;

    @Override
    default void onEvent(Event event) throws Exception {
        onBatch(List.of(event));
    }
}
