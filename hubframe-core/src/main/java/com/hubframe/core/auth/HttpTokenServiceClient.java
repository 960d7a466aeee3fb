package com.hubframe.core.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubframe.api.auth.TokenService;
import com.hubframe.api.exception.HubException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 外部令牌服务的 HTTP 客户端
 * <p>
 * 接口约定：
 * - {@code POST   {base}/tokens}  body: userId / provider / token / ttlSeconds
 * - {@code GET    {base}/tokens/{userId}/{provider}} → {@code {"token": "..."}}，404 表示不存在
 * - {@code DELETE {base}/tokens/{userId}/{provider}}
 */
@Slf4j
public class HttpTokenServiceClient implements TokenService {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI baseUri;
    private final Duration timeout;

    public HttpTokenServiceClient(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), baseUrl, timeout);
    }

    public HttpTokenServiceClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.timeout = timeout;
    }

    @Override
    public void storeToken(String userId, String provider, String token, Duration ttl) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("provider", provider);
        body.put("token", token);
        body.put("ttlSeconds", ttl.toSeconds());
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("tokens"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2) {
            throw new HubException("Token service rejected store for " + userId + "/" + provider
                    + ": HTTP " + response.statusCode());
        }
    }

    @Override
    public Optional<String> getToken(String userId, String provider) {
        HttpRequest request = HttpRequest.newBuilder(tokenUri(userId, provider))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() / 100 != 2) {
            throw new HubException("Token service lookup failed for " + userId + "/" + provider
                    + ": HTTP " + response.statusCode());
        }
        try {
            JsonNode node = objectMapper.readTree(response.body());
            JsonNode token = node.get("token");
            return token == null || token.isNull() ? Optional.empty() : Optional.of(token.asText());
        } catch (JsonProcessingException e) {
            throw new HubException("Malformed token service response", e);
        }
    }

    @Override
    public void deleteToken(String userId, String provider) {
        HttpRequest request = HttpRequest.newBuilder(tokenUri(userId, provider))
                .timeout(timeout)
                .DELETE()
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2 && response.statusCode() != 404) {
            throw new HubException("Token service delete failed for " + userId + "/" + provider
                    + ": HTTP " + response.statusCode());
        }
    }

    private URI tokenUri(String userId, String provider) {
        return baseUri.resolve("tokens/" + encode(userId) + "/" + encode(provider));
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new HubException("Token service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HubException("Interrupted while calling token service", e);
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new HubException("Failed to encode token request", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
