package com.hubframe.core.rpc;

import java.net.URI;

public interface RpcChannelFactory {

    RpcChannel open(String pluginId, URI endpoint);
}
