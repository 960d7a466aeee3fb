package com.hubframe.core.testing;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 本地 HTTP 桩服务，记录请求并按处理函数应答
 */
public class StubHttpServer implements AutoCloseable {

    @FunctionalInterface
    public interface Responder {
        Reply reply(String method, String path, String body) throws Exception;
    }

    public record Reply(int status, byte[] body) {
        public static Reply json(String json) {
            return new Reply(200, json.getBytes(StandardCharsets.UTF_8));
        }

        public static Reply status(int status) {
            return new Reply(status, new byte[0]);
        }
    }

    public record Recorded(String method, String path, String body) {
    }

    private final HttpServer server;
    public final List<Recorded> requests = new CopyOnWriteArrayList<>();

    public StubHttpServer(Responder responder) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> handle(exchange, responder));
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange, Responder responder) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String path = exchange.getRequestURI().getRawPath();
        requests.add(new Recorded(exchange.getRequestMethod(), path, body));
        Reply reply;
        try {
            reply = responder.reply(exchange.getRequestMethod(), path, body);
        } catch (Exception e) {
            reply = Reply.status(500);
        }
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        if (reply.body().length == 0) {
            exchange.sendResponseHeaders(reply.status(), -1);
        } else {
            exchange.sendResponseHeaders(reply.status(), reply.body().length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply.body());
            }
        }
        exchange.close();
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
