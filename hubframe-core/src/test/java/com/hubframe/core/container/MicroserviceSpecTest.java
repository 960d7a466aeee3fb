package com.hubframe.core.container;

import com.hubframe.api.exception.PluginLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MicroserviceSpec 单元测试")
public class MicroserviceSpecTest {

    @Test
    @DisplayName("读取 endpoint、命令、工作目录和环境变量")
    void readsConfig() {
        MicroserviceSpec spec = MicroserviceSpec.from("lights", Map.of(
                "endpoint", "http://127.0.0.1:9101",
                "command", "python3 -m lights_service",
                "workingDir", "plugins/lights",
                "env", Map.of("LOG_LEVEL", "info")));

        assertEquals(9101, spec.endpoint().getPort());
        assertEquals(List.of("python3", "-m", "lights_service"), spec.command());
        assertEquals("lights", spec.workingDir().getName());
        assertEquals("info", spec.environment().get("LOG_LEVEL"));
        assertTrue(spec.launchesProcess());
    }

    @Test
    @DisplayName("命令可以写成列表，省略时不拉起进程")
    void commandForms() {
        assertEquals(List.of("node", "index.js"),
                MicroserviceSpec.from("x", Map.of("endpoint", "http://h", "command", List.of("node", "index.js"))).command());
        assertFalse(MicroserviceSpec.from("x", Map.of("endpoint", "http://h")).launchesProcess());
    }

    @Test
    @DisplayName("缺少 endpoint 时启动失败")
    void endpointRequired() {
        PluginLoadException e = assertThrows(PluginLoadException.class, () -> MicroserviceSpec.from("x", Map.of()));
        assertEquals(PluginLoadException.Reason.START_FAILED, e.getReason());
    }
}
