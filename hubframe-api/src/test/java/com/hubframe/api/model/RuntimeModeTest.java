package com.hubframe.api.model;

import com.hubframe.api.exception.InvalidDirectionException;
import com.hubframe.api.exception.InvalidLinkTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("线上枚举解析")
public class RuntimeModeTest {

    @Test
    @DisplayName("运行模式按线上名称解析")
    void shouldParseRuntimeModeWireNames() {
        assertEquals(RuntimeMode.IN_PROCESS, RuntimeMode.fromWire("in_process"));
        assertEquals(RuntimeMode.IN_PROCESS, RuntimeMode.fromWire("In-Process"));
        assertEquals(RuntimeMode.MICROSERVICE, RuntimeMode.fromWire("microservice"));
        assertTrue(RuntimeMode.parse("quantum").isEmpty());
        assertTrue(RuntimeMode.parse(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> RuntimeMode.fromWire("quantum"));
    }

    @Test
    @DisplayName("未知关联类型和方向抛出专用异常")
    void unknownLinkValuesShouldThrow() {
        assertEquals(LinkType.BRIDGE, LinkType.fromWire("bridge"));
        assertEquals(LinkDirection.UNIDIRECTIONAL, LinkDirection.fromWire("UNIDIRECTIONAL"));
        assertThrows(InvalidLinkTypeException.class, () -> LinkType.fromWire("tunnel"));
        assertThrows(InvalidDirectionException.class, () -> LinkDirection.fromWire("sideways"));
    }

    @Test
    @DisplayName("安装类型解析")
    void shouldParseInstallType() {
        assertEquals(InstallType.GIT, InstallType.fromWire("git"));
        assertThrows(IllegalArgumentException.class, () -> InstallType.fromWire("ftp"));
    }
}
