package com.hubframe.core.rpc;

/**
 * RPC 响应
 *
 * @param ok     是否成功
 * @param result 成功时的结果
 * @param error  失败原因
 */
public record RpcResponse(boolean ok, Object result, String error) {

    public static RpcResponse success(Object result) {
        return new RpcResponse(true, result, null);
    }

    public static RpcResponse failure(String error) {
        return new RpcResponse(false, null, error);
    }
}
