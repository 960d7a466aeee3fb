package com.hubframe.core.rpc;

import com.hubframe.api.exception.RpcException;

/**
 * 宿主到微服务插件的 RPC 通道
 */
public interface RpcChannel extends AutoCloseable {

    /**
     * @throws RpcException 传输失败或响应无法解析
     */
    RpcResponse call(RpcRequest request);

    /**
     * 调用并取结果，远端返回失败时抛出 {@link RpcException}
     */
    default Object callForResult(RpcRequest request) {
        RpcResponse response = call(request);
        if (!response.ok()) {
            throw new RpcException("Remote call '" + request.method() + "' failed: " + response.error());
        }
        return response.result();
    }

    @Override
    void close();
}
