package com.hubframe.core.rpc;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 插件子进程
 * 输出逐行记录到日志；终止时先正常结束，等待宽限期后强制结束，并确认进程已退出。
 */
@Slf4j
public class ManagedProcess {

    private final String pluginId;
    private final Process process;

    private ManagedProcess(String pluginId, Process process) {
        this.pluginId = pluginId;
        this.process = process;
    }

    public static ManagedProcess start(String pluginId, List<String> command, File workingDir,
                                       Map<String, String> environment) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDir != null) {
            builder.directory(workingDir);
        }
        if (environment != null) {
            builder.environment().putAll(environment);
        }
        Process process = builder.start();
        log.info("[{}] Started plugin process pid={}: {}", pluginId, process.pid(), command);

        ManagedProcess managed = new ManagedProcess(pluginId, process);
        Thread pump = new Thread(managed::pumpOutput, "hubframe-proc-" + pluginId);
        pump.setDaemon(true);
        pump.start();
        return managed;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public long pid() {
        return process.pid();
    }

    public int exitValue() {
        return process.exitValue();
    }

    /**
     * 终止进程
     *
     * @param grace 正常结束的等待时间
     * @return 进程是否已确认退出
     */
    public boolean terminate(Duration grace) {
        if (!process.isAlive()) {
            return true;
        }
        process.destroy();
        try {
            if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("[{}] Plugin process {} exited with code {}", pluginId, process.pid(), process.exitValue());
                return true;
            }
            log.warn("[{}] Plugin process {} ignored termination, killing", pluginId, process.pid());
            process.destroyForcibly();
            boolean exited = process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                log.error("[{}] Plugin process {} could not be killed", pluginId, process.pid());
            }
            return exited;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return !process.isAlive();
        }
    }

    private void pumpOutput() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[{}] {}", pluginId, line);
            }
        } catch (IOException e) {
            log.debug("[{}] Process output closed: {}", pluginId, e.getMessage());
        }
    }
}
