package com.hubframe.api.auth;

import java.time.Duration;
import java.util.Optional;

/**
 * 外部令牌服务
 * 插件通过它托管第三方平台的访问令牌，宿主不关心令牌格式。
 *
 * @author HubFrame
 */
public interface TokenService {

    void storeToken(String userId, String provider, String token, Duration ttl);

    Optional<String> getToken(String userId, String provider);

    void deleteToken(String userId, String provider);
}
