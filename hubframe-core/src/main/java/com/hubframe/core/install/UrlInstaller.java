package com.hubframe.core.install;

import com.hubframe.api.exception.HubException;
import com.hubframe.core.loader.PluginManifest;
import com.hubframe.core.loader.PluginManifestLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.HexFormat;

/**
 * URL 安装：下载归档，校验 SHA-256，解压到插件目录
 * <p>
 * 负载：{@code url}，可选 {@code sha256}。
 * 响应不是 zip 时按单个 plugin.yml 处理。
 */
@Slf4j
public class UrlInstaller implements InstallerBackend {

    private final HttpClient httpClient;
    private final Duration timeout;

    public UrlInstaller(Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    public UrlInstaller(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public InstallResult install(InstallRequest request, InstallCallback callback) throws Exception {
        String url = request.requirePayload("url", "source");
        String expectedSha = request.payloadString("sha256");

        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
        callback.acknowledge();
        callback.log("downloading " + url);
        HttpResponse<byte[]> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() / 100 != 2) {
            throw new HubException("Download of " + url + " failed with HTTP " + response.statusCode());
        }
        byte[] body = response.body();
        String actualSha = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        callback.log("downloaded " + body.length + " bytes, sha256=" + actualSha);
        if (expectedSha != null && !expectedSha.isBlank() && !expectedSha.trim().equalsIgnoreCase(actualSha)) {
            throw new IntegrityMismatchException(url, expectedSha.trim(), actualSha);
        }

        Path target = request.pluginDirectory();
        InstallFiles.deleteRecursively(target);
        Files.createDirectories(target);
        if (isZip(body)) {
            try (InputStream in = new ByteArrayInputStream(body)) {
                int files = InstallFiles.unzip(in, target);
                callback.log("extracted " + files + " files to " + target);
            }
        } else {
            Files.write(target.resolve(PluginManifestLoader.MANIFEST_FILE), body);
            callback.log("stored manifest at " + target);
        }

        Path manifestDir = InstallFiles.locateManifestDir(target);
        PluginManifest manifest = PluginManifestLoader.load(manifestDir);
        log.info("[{}] Installed v{} from {}", request.pluginId(), manifest.getVersion(), url);
        return new InstallResult(manifest, manifestDir);
    }

    private static boolean isZip(byte[] body) {
        return body.length >= 4 && body[0] == 'P' && body[1] == 'K' && body[2] == 3 && body[3] == 4;
    }
}
