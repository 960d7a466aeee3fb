package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 事件处理器执行失败
 * 只用于记录和统计，不会传播给发布者。
 */
@Getter
public class HandlerFailureException extends HubException {

    private final String topic;
    private final String subscriptionId;

    public HandlerFailureException(String topic, String subscriptionId, Throwable cause) {
        super("Handler " + subscriptionId + " failed on topic " + topic, cause);
        this.topic = topic;
        this.subscriptionId = subscriptionId;
    }
}
