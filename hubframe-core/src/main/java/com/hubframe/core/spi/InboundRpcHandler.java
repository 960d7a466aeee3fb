package com.hubframe.core.spi;

import com.hubframe.core.rpc.RpcRequest;
import com.hubframe.core.rpc.RpcResponse;

/**
 * 处理远端插件发往宿主的调用（emitEvent / subscribeEvent / bindDevices 等）
 */
public interface InboundRpcHandler {

    RpcResponse handleInbound(RpcRequest request);
}
