package com.hubframe.api.exception;

/**
 * 微服务插件 RPC 通道异常（连接失败、远端返回错误、响应无法解析）
 */
public class RpcException extends HubException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
