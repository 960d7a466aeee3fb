package com.hubframe.core.install;

import com.hubframe.api.exception.HubException;
import com.hubframe.core.loader.PluginManifest;
import com.hubframe.core.loader.PluginManifestLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 源码仓库安装：{@code git clone --depth 1} 到插件目录
 * <p>
 * 负载：{@code git_url}，可选 {@code branch}
 */
@Slf4j
public class GitInstaller implements InstallerBackend {

    private final String gitExecutable;
    private final Duration timeout;

    public GitInstaller(Duration timeout) {
        this("git", timeout);
    }

    public GitInstaller(String gitExecutable, Duration timeout) {
        this.gitExecutable = gitExecutable;
        this.timeout = timeout;
    }

    @Override
    public InstallResult install(InstallRequest request, InstallCallback callback) throws Exception {
        String repository = request.requirePayload("git_url", "url", "source");
        String branch = request.payloadString("branch");
        Path target = request.pluginDirectory();
        InstallFiles.deleteRecursively(target);
        Files.createDirectories(target.toAbsolutePath().getParent());

        List<String> command = new ArrayList<>(List.of(gitExecutable, "clone", "--depth", "1"));
        if (branch != null && !branch.isBlank()) {
            command.add("--branch");
            command.add(branch);
        }
        command.add(repository);
        command.add(target.toAbsolutePath().toString());

        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        callback.acknowledge();
        callback.log(String.join(" ", command));
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    callback.log(line);
                }
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new HubException("git clone of " + repository + " did not finish within " + timeout.toSeconds() + "s");
            }
            if (process.exitValue() != 0) {
                throw new HubException("git clone of " + repository + " exited with code " + process.exitValue());
            }
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }

        Path manifestDir = InstallFiles.locateManifestDir(target);
        PluginManifest manifest = PluginManifestLoader.load(manifestDir);
        log.info("[{}] Cloned {}{} -> v{}", request.pluginId(), repository,
                branch == null ? "" : "@" + branch, manifest.getVersion());
        return new InstallResult(manifest, manifestDir);
    }
}
